package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.repository.ScoreRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaScoreRepositoryImpl implements ScoreRepository {
    
    private final ScoreJpaRepository jpaRepository;
    
    @Autowired
    public JpaScoreRepositoryImpl(ScoreJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Optional<Score> findById(long scoreId) {
        return jpaRepository.findById(scoreId);
    }
    
    @Override
    public List<Score> findByUserIdAndRulesetId(int userId, int rulesetId) {
        return jpaRepository.findByUserIdAndRulesetId(userId, rulesetId);
    }
    
    @Override
    public List<Score> findPassedByUserIdAndBeatmapIds(int userId, Collection<Integer> beatmapIds) {
        if (beatmapIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findByUserIdAndPassedTrueAndBeatmapIdIn(userId, beatmapIds);
    }
    
    @Override
    public List<Score> findProcessedRankedPassedScores(int userId, int beatmapId, int rulesetId) {
        return jpaRepository.findProcessedRankedPassed(userId, beatmapId, rulesetId);
    }
    
    @Override
    public List<Score> findRankedPassedScores(int userId, int rulesetId) {
        return jpaRepository.findByUserIdAndRulesetIdAndPassedTrueAndRankedTrue(userId, rulesetId);
    }
    
    @Override
    public List<Long> findNonPreservedScoreIdsUpdatedBefore(Instant cutoff, int limit) {
        return jpaRepository.findNonPreservedIds(cutoff, PageRequest.of(0, limit));
    }
    
    @Override
    @Transactional
    public void updatePerformance(long scoreId, double pp) {
        jpaRepository.updatePp(scoreId, pp);
    }
    
    @Override
    @Transactional
    public void markNonRanked(long scoreId) {
        jpaRepository.markNonRanked(scoreId);
    }
    
    @Override
    @Transactional
    public void markPreserved(long scoreId) {
        jpaRepository.markPreserved(scoreId);
    }
    
    @Override
    @Transactional
    public void deleteById(long scoreId) {
        jpaRepository.deleteById(scoreId);
    }
}
