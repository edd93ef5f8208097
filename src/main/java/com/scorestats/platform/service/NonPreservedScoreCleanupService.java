package com.scorestats.platform.service;

import com.scorestats.platform.repository.ScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes scores which were never preserved once they are old enough.
 * Replays stored alongside the deleted scores are left to the storage service.
 */
@Service
public class NonPreservedScoreCleanupService {
    
    private static final Logger logger = LoggerFactory.getLogger(NonPreservedScoreCleanupService.class);
    
    private static final int PAGE_SIZE = 1000;
    
    private final ScoreRepository scoreRepository;
    private final BatchJobTracker jobTracker;
    private final Clock clock;
    private final Duration retention;
    
    @Autowired
    public NonPreservedScoreCleanupService(
            ScoreRepository scoreRepository,
            BatchJobTracker jobTracker,
            Clock clock,
            @Value("${score-statistics.cleanup.preserve-hours:48}") long preserveHours) {
        this.scoreRepository = scoreRepository;
        this.jobTracker = jobTracker;
        this.clock = clock;
        this.retention = Duration.ofHours(preserveHours);
    }
    
    public BatchResult deleteStaleScores() {
        CancellationSignal signal = jobTracker.start();
        
        try {
            return deleteStaleScores(signal);
        } finally {
            jobTracker.finish(signal);
        }
    }
    
    BatchResult deleteStaleScores(CancellationSignal signal) {
        Instant cutoff = Instant.now(clock).minus(retention);
        int deleted = 0;
        
        while (!signal.isCancelled()) {
            List<Long> scoreIds = scoreRepository.findNonPreservedScoreIdsUpdatedBefore(cutoff, PAGE_SIZE);
            
            if (scoreIds.isEmpty()) {
                break;
            }
            
            for (Long scoreId : scoreIds) {
                if (signal.isCancelled()) {
                    break;
                }
                
                logger.debug("Deleting score {}", scoreId);
                scoreRepository.deleteById(scoreId);
                deleted++;
            }
        }
        
        logger.info("Deleted {} non-preserved scores updated before {}{}", deleted, cutoff,
            signal.isCancelled() ? " (cancelled)" : "");
        
        return new BatchResult(deleted, deleted, signal.isCancelled());
    }
}
