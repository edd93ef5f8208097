package com.scorestats.platform.processor;

import com.scorestats.platform.calculation.ModUtils;
import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.BeatmapOnlineStatus;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.store.BeatmapStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Raises the user's max combo if required. Applying is idempotent, so reverting does nothing.
 */
@Component
public class MaxComboProcessor implements ScoreProcessor {
    
    private final BeatmapStore beatmapStore;
    
    @Autowired
    public MaxComboProcessor(BeatmapStore beatmapStore) {
        this.beatmapStore = beatmapStore;
    }
    
    @Override
    public boolean runOnFailedScores() {
        return false;
    }
    
    @Override
    public boolean runOnLegacyScores() {
        return false;
    }
    
    @Override
    public void applyToUserStats(Score score, UserStats userStats) {
        // Automation mods should not count towards max combo.
        if (ModUtils.containsAutomation(score.getMods())) {
            return;
        }
        
        Optional<Beatmap> beatmap = beatmapStore.getBeatmap(score.getBeatmapId());
        if (beatmap.isEmpty() || beatmap.get().getApproved().getValue() < BeatmapOnlineStatus.RANKED.getValue()) {
            return;
        }
        
        userStats.setMaxCombo(Math.max(userStats.getMaxCombo(), score.getMaxCombo()));
    }
    
    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
    }
    
    @Override
    public void applyGlobal(Score score) {
    }
}
