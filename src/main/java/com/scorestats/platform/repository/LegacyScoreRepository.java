package com.scorestats.platform.repository;

import com.scorestats.platform.model.Ruleset;

/**
 * Mirrors for the per-ruleset high score tables of the previous scoring system.
 */
public interface LegacyScoreRepository {
    void updatePerformance(Ruleset ruleset, long legacyScoreId, double pp);
}
