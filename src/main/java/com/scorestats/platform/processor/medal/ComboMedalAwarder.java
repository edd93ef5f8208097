package com.scorestats.platform.processor.medal;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.MedalConditionType;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.store.BeatmapStore;

/**
 * Awards combo milestones reached on ranked or approved beatmaps.
 */
public class ComboMedalAwarder implements MedalAwarder {
    
    private final BeatmapStore beatmapStore;
    
    public ComboMedalAwarder(BeatmapStore beatmapStore) {
        this.beatmapStore = beatmapStore;
    }
    
    @Override
    public MedalConditionType getConditionType() {
        return MedalConditionType.COMBO;
    }
    
    @Override
    public boolean isAwardable(Medal medal, Score score, UserStats userStats) {
        if (medal.getThreshold() == null || score.getMaxCombo() < medal.getThreshold()) {
            return false;
        }
        return beatmapStore.getBeatmap(score.getBeatmapId())
            .map(Beatmap::isRankedOrApproved)
            .orElse(false);
    }
}
