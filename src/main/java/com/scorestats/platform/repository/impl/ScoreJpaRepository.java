package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Score;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface ScoreJpaRepository extends JpaRepository<Score, Long> {
    List<Score> findByUserIdAndRulesetId(int userId, int rulesetId);
    List<Score> findByUserIdAndPassedTrueAndBeatmapIdIn(int userId, Collection<Integer> beatmapIds);
    
    @Query("SELECT s FROM Score s WHERE s.userId = :userId AND s.beatmapId = :beatmapId AND s.rulesetId = :rulesetId"
        + " AND s.passed = true AND s.ranked = true"
        + " AND EXISTS (SELECT h FROM ProcessHistory h WHERE h.scoreId = s.id)")
    List<Score> findProcessedRankedPassed(
        @Param("userId") int userId,
        @Param("beatmapId") int beatmapId,
        @Param("rulesetId") int rulesetId);
    
    List<Score> findByUserIdAndRulesetIdAndPassedTrueAndRankedTrue(int userId, int rulesetId);
    
    @Query("SELECT s.id FROM Score s WHERE s.preserve = false AND s.updatedAt < :cutoff ORDER BY s.id")
    List<Long> findNonPreservedIds(@Param("cutoff") Instant cutoff, Pageable pageable);
    
    @Modifying
    @Query("UPDATE Score s SET s.pp = :pp WHERE s.id = :scoreId")
    int updatePp(@Param("scoreId") long scoreId, @Param("pp") double pp);
    
    @Modifying
    @Query("UPDATE Score s SET s.ranked = false WHERE s.id = :scoreId")
    int markNonRanked(@Param("scoreId") long scoreId);
    
    @Modifying
    @Query("UPDATE Score s SET s.preserve = true WHERE s.id = :scoreId")
    int markPreserved(@Param("scoreId") long scoreId);
}
