package com.scorestats.platform.calculation;

import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.model.Score;

import java.util.OptionalDouble;

/**
 * Computes the performance value of a score for one ruleset. Implementations live outside this service.
 */
public interface PerformanceCalculator {
    Ruleset getRuleset();
    OptionalDouble computePerformance(Score score, DifficultyAttributes attributes);
}
