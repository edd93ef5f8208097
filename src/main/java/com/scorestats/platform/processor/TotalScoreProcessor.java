package com.scorestats.platform.processor;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import org.springframework.stereotype.Component;

/**
 * Adds a score's total score and hit count to the user's totals.
 */
@Component
public class TotalScoreProcessor implements ScoreProcessor {
    
    /**
     * From this version on, only valid plays are counted.
     */
    public static final int VALID_PLAYS_ONLY_VERSION = 11;
    
    @Override
    public boolean runOnFailedScores() {
        return true;
    }
    
    @Override
    public boolean runOnLegacyScores() {
        return false;
    }
    
    @Override
    public void applyToUserStats(Score score, UserStats userStats) {
        if (!PlayCountProcessor.isValidPlay(score)) {
            return;
        }
        userStats.setTotalScore(userStats.getTotalScore() + score.getTotalScore());
        userStats.setTotalHits(userStats.getTotalHits() + score.getTotalHits());
    }
    
    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
        if (previousVersion < VALID_PLAYS_ONLY_VERSION || PlayCountProcessor.isValidPlay(score)) {
            userStats.setTotalScore(userStats.getTotalScore() - score.getTotalScore());
            userStats.setTotalHits(userStats.getTotalHits() - score.getTotalHits());
        }
    }
    
    @Override
    public void applyGlobal(Score score) {
    }
}
