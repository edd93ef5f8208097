package com.scorestats.platform.processor.medal;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.MedalConditionType;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;

/**
 * Decides whether a medal of one condition type has been earned, given a passed score and the user's
 * statistics after that score was applied.
 */
public interface MedalAwarder {
    MedalConditionType getConditionType();
    boolean isAwardable(Medal medal, Score score, UserStats userStats);
}
