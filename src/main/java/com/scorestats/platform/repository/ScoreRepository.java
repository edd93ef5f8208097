package com.scorestats.platform.repository;

import com.scorestats.platform.model.Score;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ScoreRepository {
    Optional<Score> findById(long scoreId);
    List<Score> findByUserIdAndRulesetId(int userId, int rulesetId);
    List<Score> findPassedByUserIdAndBeatmapIds(int userId, Collection<Integer> beatmapIds);
    /**
     * Ranked passed scores on a beatmap which have already been folded into the user's statistics.
     */
    List<Score> findProcessedRankedPassedScores(int userId, int beatmapId, int rulesetId);
    List<Score> findRankedPassedScores(int userId, int rulesetId);
    List<Long> findNonPreservedScoreIdsUpdatedBefore(Instant cutoff, int limit);
    void updatePerformance(long scoreId, double pp);
    void markNonRanked(long scoreId);
    void markPreserved(long scoreId);
    void deleteById(long scoreId);
}
