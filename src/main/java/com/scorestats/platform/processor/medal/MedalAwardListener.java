package com.scorestats.platform.processor.medal;

@FunctionalInterface
public interface MedalAwardListener {
    void onMedalAwarded(AwardedMedal awardedMedal);
}
