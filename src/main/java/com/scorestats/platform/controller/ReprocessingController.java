package com.scorestats.platform.controller;

import com.scorestats.platform.dto.BatchResponse;
import com.scorestats.platform.dto.ReprocessScoresRequest;
import com.scorestats.platform.dto.ReprocessUsersRequest;
import com.scorestats.platform.service.BatchResult;
import com.scorestats.platform.service.NonPreservedScoreCleanupService;
import com.scorestats.platform.service.PerformanceReprocessingService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Batch maintenance operations. Requests block until the batch finishes or is cancelled.
 */
@RestController
@RequestMapping("/api/v1/reprocessing")
public class ReprocessingController {
    
    private static final Logger logger = LoggerFactory.getLogger(ReprocessingController.class);
    
    private final PerformanceReprocessingService reprocessingService;
    private final NonPreservedScoreCleanupService cleanupService;
    
    @Autowired
    public ReprocessingController(
            PerformanceReprocessingService reprocessingService,
            NonPreservedScoreCleanupService cleanupService) {
        this.reprocessingService = reprocessingService;
        this.cleanupService = cleanupService;
    }
    
    /**
     * Recompute the performance of every score of the given users.
     * POST /api/v1/reprocessing/performance/scores
     */
    @PostMapping("/performance/scores")
    public ResponseEntity<BatchResponse> processUserScores(@Valid @RequestBody ReprocessUsersRequest request) {
        logger.info("Received request to process scores - ruleset: {}, users: {}, threads: {}",
            request.getRulesetId(), request.getUserIds().size(), request.getThreads());
        
        BatchResult result = reprocessingService.processUserScores(request.getRulesetId(), request.getUserIds(), request.getThreads());
        return ResponseEntity.ok(BatchResponse.from(result));
    }
    
    /**
     * Recompute the total performance of the given users.
     * POST /api/v1/reprocessing/performance/user-totals
     */
    @PostMapping("/performance/user-totals")
    public ResponseEntity<BatchResponse> processUserTotals(@Valid @RequestBody ReprocessUsersRequest request) {
        logger.info("Received request to process user totals - ruleset: {}, users: {}, threads: {}",
            request.getRulesetId(), request.getUserIds().size(), request.getThreads());
        
        BatchResult result = reprocessingService.processUserTotals(request.getRulesetId(), request.getUserIds(), request.getThreads());
        return ResponseEntity.ok(BatchResponse.from(result));
    }
    
    /**
     * Recompute the performance of individual scores.
     * POST /api/v1/reprocessing/performance/score-ids
     */
    @PostMapping("/performance/score-ids")
    public ResponseEntity<BatchResponse> processScores(@Valid @RequestBody ReprocessScoresRequest request) {
        logger.info("Received request to process score IDs - scores: {}, threads: {}",
            request.getScoreIds().size(), request.getThreads());
        
        BatchResult result = reprocessingService.processScores(request.getScoreIds(), request.getThreads());
        return ResponseEntity.ok(BatchResponse.from(result));
    }
    
    /**
     * Delete stale non-preserved scores.
     * POST /api/v1/reprocessing/cleanup
     */
    @PostMapping("/cleanup")
    public ResponseEntity<BatchResponse> cleanup() {
        logger.info("Received request to delete non-preserved scores");
        return ResponseEntity.ok(BatchResponse.from(cleanupService.deleteStaleScores()));
    }
    
    /**
     * Ask every running batch to stop after its current key.
     * POST /api/v1/reprocessing/cancel
     */
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Integer>> cancel() {
        int cancelled = reprocessingService.cancelAll();
        logger.info("Cancellation requested for {} running batches", cancelled);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }
}
