package com.scorestats.platform.processor.medal;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.MedalConditionType;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;

public class PlayCountMedalAwarder implements MedalAwarder {
    
    @Override
    public MedalConditionType getConditionType() {
        return MedalConditionType.PLAY_COUNT;
    }
    
    @Override
    public boolean isAwardable(Medal medal, Score score, UserStats userStats) {
        return medal.getThreshold() != null && userStats.getPlayCount() >= medal.getThreshold();
    }
}
