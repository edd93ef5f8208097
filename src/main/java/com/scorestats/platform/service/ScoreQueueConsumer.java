package com.scorestats.platform.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scorestats.platform.model.ScoreItem;
import com.scorestats.platform.repository.ProcessHistoryRepository;
import com.scorestats.platform.repository.QueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the score queue and hands each item to the pipeline.
 * <p>
 * Delivery is at least once: a failed item goes back on the queue with its retry count raised, and is dropped
 * once it has failed too many times.
 */
@Component
public class ScoreQueueConsumer {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreQueueConsumer.class);
    
    private final ScoreStatisticsQueueProcessor queueProcessor;
    private final ProcessHistoryRepository processHistoryRepository;
    private final QueueRepository queueRepository;
    private final String inputQueue;
    private final int batchSize;
    private final int maxRetries;
    private final ObjectMapper objectMapper;
    
    @Autowired
    public ScoreQueueConsumer(
            ScoreStatisticsQueueProcessor queueProcessor,
            ProcessHistoryRepository processHistoryRepository,
            QueueRepository queueRepository,
            @Value("${score-statistics.queue.input:score-statistics}") String inputQueue,
            @Value("${score-statistics.queue.batch-size:50}") int batchSize,
            @Value("${score-statistics.queue.max-retries:5}") int maxRetries) {
        this.queueProcessor = queueProcessor;
        this.processHistoryRepository = processHistoryRepository;
        this.queueRepository = queueRepository;
        this.inputQueue = inputQueue;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
    
    /**
     * Poll the input queue once the previous batch has finished.
     */
    @Scheduled(fixedDelayString = "${score-statistics.queue.poll-interval-ms:1000}")
    public void poll() {
        if (!queueRepository.isAvailable()) {
            logger.warn("Redis is not available, skipping poll of {}", inputQueue);
            return;
        }
        
        try {
            List<String> payloads = queueRepository.pop(inputQueue, batchSize);
            
            for (String payload : payloads) {
                handle(payload);
            }
        } catch (Exception e) {
            logger.error("Error polling queue {}", inputQueue, e);
        }
    }
    
    /**
     * Processes one queued payload.
     *
     * @return true if the item was processed
     */
    public boolean handle(String payload) {
        ScoreItem item;
        
        try {
            item = objectMapper.readValue(payload, ScoreItem.class);
        } catch (Exception e) {
            logger.error("Dropping unreadable queue item: {}", payload, e);
            return false;
        }
        
        if (item.getScore() == null || item.getScore().getId() == null) {
            logger.error("Dropping queue item without a score: {}", payload);
            return false;
        }
        
        try {
            if (item.getProcessHistory() == null) {
                processHistoryRepository.findByScoreId(item.getScore().getId()).ifPresent(item::setProcessHistory);
            }
            
            queueProcessor.processResult(item);
            return true;
        } catch (Exception e) {
            requeue(item, e);
            return false;
        }
    }
    
    private void requeue(ScoreItem item, Exception cause) {
        int retryCount = item.getRetryCount() == null ? 0 : item.getRetryCount();
        
        if (retryCount >= maxRetries) {
            logger.error("Dropping score {} after {} attempts", item.getScore().getId(), retryCount + 1, cause);
            return;
        }
        
        item.setRetryCount(retryCount + 1);
        
        try {
            queueRepository.push(inputQueue, objectMapper.writeValueAsString(item));
            logger.warn("Requeued score {} for retry {} - error: {}", item.getScore().getId(), item.getRetryCount(), cause.getMessage());
        } catch (Exception e) {
            logger.error("Failed to requeue score {}", item.getScore().getId(), e);
        }
    }
}
