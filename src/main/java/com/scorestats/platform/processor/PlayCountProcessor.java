package com.scorestats.platform.processor;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import org.springframework.stereotype.Component;

/**
 * Increments the user's play count.
 */
@Component
public class PlayCountProcessor implements ScoreProcessor {
    
    /**
     * From this version on, only valid plays are counted.
     */
    public static final int VALID_PLAYS_ONLY_VERSION = 10;
    
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
        if (!isValidPlay(score)) {
            return;
        }
        userStats.setPlayCount(userStats.getPlayCount() + 1);
    }
    
    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
        if (previousVersion < VALID_PLAYS_ONLY_VERSION || isValidPlay(score)) {
            userStats.setPlayCount(userStats.getPlayCount() - 1);
        }
    }
    
    @Override
    public void applyGlobal(Score score) {
    }
    
    /**
     * A play counts towards play statistics once at least one object was hit.
     */
    static boolean isValidPlay(Score score) {
        return score.getTotalHits() > 0;
    }
}
