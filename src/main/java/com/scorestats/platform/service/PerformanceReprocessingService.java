package com.scorestats.platform.service;

import com.scorestats.platform.exception.InvalidRequestException;
import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.processor.ScorePerformanceProcessor;
import com.scorestats.platform.processor.UserTotalPerformanceProcessor;
import com.scorestats.platform.repository.UserStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Recomputes performance values outside the queue, using the same processors as the live pipeline.
 * <p>
 * Callers must not reprocess a user who is also being processed by the queue at the same time.
 */
@Service
public class PerformanceReprocessingService {
    
    private static final Logger logger = LoggerFactory.getLogger(PerformanceReprocessingService.class);
    
    private final ScorePerformanceProcessor scorePerformanceProcessor;
    private final UserTotalPerformanceProcessor totalPerformanceProcessor;
    private final UserStatsRepository userStatsRepository;
    private final BatchJobTracker jobTracker;
    
    @Autowired
    public PerformanceReprocessingService(
            ScorePerformanceProcessor scorePerformanceProcessor,
            UserTotalPerformanceProcessor totalPerformanceProcessor,
            UserStatsRepository userStatsRepository,
            BatchJobTracker jobTracker) {
        this.scorePerformanceProcessor = scorePerformanceProcessor;
        this.totalPerformanceProcessor = totalPerformanceProcessor;
        this.userStatsRepository = userStatsRepository;
        this.jobTracker = jobTracker;
    }
    
    /**
     * Recomputes the performance of every score of the given users, mirroring values of legacy scores.
     */
    public BatchResult processUserScores(int rulesetId, List<Integer> userIds, int threads) {
        validate(rulesetId, threads);
        
        return run("user score processing", userIds, threads, userId -> {
            List<Score> scores = scorePerformanceProcessor.processUserScores(userId, rulesetId);
            
            for (Score score : scores) {
                scorePerformanceProcessor.applyGlobal(score);
            }
        });
    }
    
    /**
     * Recomputes the total performance of the given users from their stored scores.
     */
    public BatchResult processUserTotals(int rulesetId, List<Integer> userIds, int threads) {
        validate(rulesetId, threads);
        
        return run("user total processing", userIds, threads, userId -> {
            Optional<UserStats> userStats = userStatsRepository.find(userId, rulesetId);
            
            if (userStats.isEmpty()) {
                return;
            }
            
            totalPerformanceProcessor.updateUserStats(userStats.get());
            userStatsRepository.save(userStats.get());
        });
    }
    
    /**
     * Recomputes the performance of individual scores.
     */
    public BatchResult processScores(List<Long> scoreIds, int threads) {
        validateThreads(threads);
        
        return run("score processing", scoreIds, threads, scorePerformanceProcessor::processScore);
    }
    
    public int cancelAll() {
        return jobTracker.cancelAll();
    }
    
    private <T> BatchResult run(String name, List<T> keys, int threads, Consumer<T> action) {
        if (keys.isEmpty()) {
            logger.info("No matching keys for {}", name);
            return new BatchResult(0, 0, false);
        }
        
        CancellationSignal signal = jobTracker.start();
        
        try {
            return new PartitionedWorkerPool(name, threads).run(keys, signal, action);
        } finally {
            jobTracker.finish(signal);
        }
    }
    
    private void validate(int rulesetId, int threads) {
        if (!Ruleset.isSupported(rulesetId)) {
            throw new InvalidRequestException("Unsupported ruleset: " + rulesetId);
        }
        validateThreads(threads);
    }
    
    private void validateThreads(int threads) {
        if (threads < 1) {
            throw new InvalidRequestException("Threads must be at least 1");
        }
    }
}
