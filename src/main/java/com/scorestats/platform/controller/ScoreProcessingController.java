package com.scorestats.platform.controller;

import com.scorestats.platform.dto.ProcessScoreResponse;
import com.scorestats.platform.model.ScoreItem;
import com.scorestats.platform.service.ScoreStatisticsQueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/scores")
public class ScoreProcessingController {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreProcessingController.class);
    
    private final ScoreStatisticsQueueProcessor queueProcessor;
    
    @Autowired
    public ScoreProcessingController(ScoreStatisticsQueueProcessor queueProcessor) {
        this.queueProcessor = queueProcessor;
    }
    
    /**
     * Run the statistics pipeline for a stored score.
     * POST /api/v1/scores/{scoreId}/process
     */
    @PostMapping("/{scoreId}/process")
    public ResponseEntity<ProcessScoreResponse> processScore(@PathVariable long scoreId) {
        logger.info("Received POST request to process score - scoreId: {}", scoreId);
        
        ScoreItem item = queueProcessor.processScore(scoreId);
        
        ProcessScoreResponse response = ProcessScoreResponse.builder()
            .scoreId(scoreId)
            .processedVersion(item.getProcessHistory() != null ? item.getProcessHistory().getProcessedVersion() : null)
            .tags(item.getTags())
            .build();
        
        logger.info("Processed score - scoreId: {}, tags: {}", scoreId, item.getTags());
        return ResponseEntity.ok(response);
    }
}
