package com.scorestats.platform.support;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.repository.ScoreRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Score storage backed by a map, standing in for the scores table.
 */
public class InMemoryScoreRepository implements ScoreRepository {
    
    private final Map<Long, Score> scores = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final InMemoryProcessHistoryRepository processHistoryRepository;
    
    public InMemoryScoreRepository(InMemoryProcessHistoryRepository processHistoryRepository) {
        this.processHistoryRepository = processHistoryRepository;
    }
    
    public Score add(Score score) {
        if (score.getId() == null) {
            score.setId(nextId.getAndIncrement());
        }
        scores.put(score.getId(), score);
        return score;
    }
    
    public Collection<Score> all() {
        return scores.values();
    }
    
    @Override
    public Optional<Score> findById(long scoreId) {
        return Optional.ofNullable(scores.get(scoreId));
    }
    
    @Override
    public List<Score> findByUserIdAndRulesetId(int userId, int rulesetId) {
        return scores.values().stream()
            .filter(s -> s.getUserId() == userId && s.getRulesetId() == rulesetId)
            .toList();
    }
    
    @Override
    public List<Score> findPassedByUserIdAndBeatmapIds(int userId, Collection<Integer> beatmapIds) {
        return scores.values().stream()
            .filter(s -> s.getUserId() == userId && s.isPassed() && beatmapIds.contains(s.getBeatmapId()))
            .toList();
    }
    
    @Override
    public List<Score> findProcessedRankedPassedScores(int userId, int beatmapId, int rulesetId) {
        return scores.values().stream()
            .filter(s -> s.getUserId() == userId && s.getBeatmapId() == beatmapId && s.getRulesetId() == rulesetId)
            .filter(s -> s.isPassed() && s.isRanked())
            .filter(s -> processHistoryRepository.findByScoreId(s.getId()).isPresent())
            .toList();
    }
    
    @Override
    public List<Score> findRankedPassedScores(int userId, int rulesetId) {
        return scores.values().stream()
            .filter(s -> s.getUserId() == userId && s.getRulesetId() == rulesetId)
            .filter(s -> s.isPassed() && s.isRanked())
            .toList();
    }
    
    @Override
    public List<Long> findNonPreservedScoreIdsUpdatedBefore(Instant cutoff, int limit) {
        List<Long> ids = new ArrayList<>();
        for (Score score : scores.values()) {
            if (!score.isPreserve() && score.getUpdatedAt() != null && score.getUpdatedAt().isBefore(cutoff)) {
                ids.add(score.getId());
            }
        }
        return ids.stream().sorted().limit(limit).toList();
    }
    
    @Override
    public void updatePerformance(long scoreId, double pp) {
        findById(scoreId).ifPresent(s -> s.setPp(pp));
    }
    
    @Override
    public void markNonRanked(long scoreId) {
        findById(scoreId).ifPresent(s -> s.setRanked(false));
    }
    
    @Override
    public void markPreserved(long scoreId) {
        findById(scoreId).ifPresent(s -> s.setPreserve(true));
    }
    
    @Override
    public void deleteById(long scoreId) {
        scores.remove(scoreId);
    }
}
