package com.scorestats.platform.processor;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;

/**
 * A unit which owns one family of user statistics.
 * <p>
 * {@link #applyToUserStats} and {@link #revertFromUserStats} run inside the per-score transaction and must
 * only touch transactional state. For the same score and stats, revert must exactly undo apply as it ran
 * under {@code previousVersion}. {@link #applyGlobal} runs after commit and may touch anything;
 * {@link #onRollback} runs instead when the transaction failed.
 */
public interface ScoreProcessor {
    
    int DEFAULT_ORDER = 10;
    
    /**
     * Processors run in ascending order, ties keeping registration order.
     */
    default int getOrder() {
        return DEFAULT_ORDER;
    }
    
    boolean runOnFailedScores();
    
    boolean runOnLegacyScores();
    
    void applyToUserStats(Score score, UserStats userStats);
    
    void revertFromUserStats(Score score, UserStats userStats, int previousVersion);
    
    void applyGlobal(Score score);
    
    /**
     * Called when the transaction which applied {@code score} rolled back, so state held for
     * {@link #applyGlobal} can be dropped.
     */
    default void onRollback(Score score) {
    }
    
    default String getName() {
        return getClass().getSimpleName();
    }
}
