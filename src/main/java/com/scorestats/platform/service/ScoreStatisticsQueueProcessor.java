package com.scorestats.platform.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorestats.platform.exception.ScoreNotFoundException;
import com.scorestats.platform.model.ProcessHistory;
import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.ScoreItem;
import com.scorestats.platform.model.ScoreProcessedMessage;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.processor.ProcessorRegistry;
import com.scorestats.platform.processor.ScoreProcessor;
import com.scorestats.platform.repository.ProcessHistoryRepository;
import com.scorestats.platform.repository.QueueRepository;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.repository.UserStatsRepository;
import com.scorestats.platform.store.BeatmapStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Folds scores into their user's statistics, once per pipeline version.
 */
@Service
public class ScoreStatisticsQueueProcessor {
    
    /**
     * version 1: basic playcount
     * version 2: total score, hit statistics, beatmap playcount, monthly playcount, max combo
     * version 3: fixed incorrect revert condition for beatmap/monthly playcount
     * version 4: moved all score content to a json data block
     * version 5: added performance processor
     * version 6: added play time processor
     * version 7: added user rank count processor
     * version 8: switched total score processor from standardised score to classic score
     * version 9: added ranked score processor
     * version 10: modified play count and time processors to only track valid scores
     * version 11: modified total score processor to only count valid scores
     */
    public static final int VERSION = 11;
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreStatisticsQueueProcessor.class);
    
    private final ProcessorRegistry processorRegistry;
    private final UserStatsRepository userStatsRepository;
    private final ProcessHistoryRepository processHistoryRepository;
    private final ScoreRepository scoreRepository;
    private final QueueRepository queueRepository;
    private final BeatmapStore beatmapStore;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final String indexQueue;
    private final String processedChannel;
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    @Autowired
    public ScoreStatisticsQueueProcessor(
            ProcessorRegistry processorRegistry,
            UserStatsRepository userStatsRepository,
            ProcessHistoryRepository processHistoryRepository,
            ScoreRepository scoreRepository,
            QueueRepository queueRepository,
            BeatmapStore beatmapStore,
            TransactionTemplate transactionTemplate,
            Clock clock,
            @Value("${score-statistics.index.queue:score-index-1}") String indexQueue,
            @Value("${score-statistics.events.score-processed-channel:osu-channel:score:processed}") String processedChannel) {
        this.processorRegistry = processorRegistry;
        this.userStatsRepository = userStatsRepository;
        this.processHistoryRepository = processHistoryRepository;
        this.scoreRepository = scoreRepository;
        this.queueRepository = queueRepository;
        this.beatmapStore = beatmapStore;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.indexQueue = indexQueue;
        this.processedChannel = processedChannel;
    }
    
    /**
     * Processes a stored score outside the queue, using its stored history.
     */
    public ScoreItem processScore(long scoreId) {
        Score score = scoreRepository.findById(scoreId)
            .orElseThrow(() -> new ScoreNotFoundException("Score not found with ID: " + scoreId));
        
        ScoreItem item = ScoreItem.builder()
            .score(score)
            .processHistory(processHistoryRepository.findByScoreId(scoreId).orElse(null))
            .build();
        
        processResult(item);
        return item;
    }
    
    /**
     * Reverts the previous contribution of the score if there is one, then applies it with every eligible
     * processor and records the current version, all in one transaction.
     * Side effects outside the user's statistics run after commit and never fail the item.
     */
    public void processResult(ScoreItem item) {
        Score score = item.getScore();
        List<String> tags = item.getTags();
        
        try {
            tags.add("ruleset:" + score.getRulesetId());
            
            if (score.isLegacyScore()) {
                tags.add("type:legacy");
            }
            
            if (item.getProcessHistory() != null && item.getProcessHistory().getProcessedVersion() == VERSION) {
                tags.add("type:skipped");
                return;
            }
            
            score.setBeatmap(beatmapStore.getBeatmap(score.getBeatmapId()).orElse(null));
            
            List<ScoreProcessor> processors = processorRegistry.getEligibleProcessors(score);
            
            ProcessHistory history;
            
            try {
                history = transactionTemplate.execute(status -> applyInTransaction(item, processors));
            } catch (RuntimeException e) {
                for (ScoreProcessor processor : processors) {
                    processor.onRollback(score);
                }
                throw e;
            }
            
            if (history == null) {
                return;
            }
            
            item.setProcessHistory(history);
            
            runPostCommitEffects(score, processors, history);
        } catch (RuntimeException e) {
            logger.error("Failed to process score {} - tags: {}", score.getId(), tags, e);
            throw e;
        } finally {
            logger.debug("Processed score {} - tags: {}", score.getId(), tags);
        }
    }
    
    private ProcessHistory applyInTransaction(ScoreItem item, List<ScoreProcessor> processors) {
        Score score = item.getScore();
        List<String> tags = item.getTags();
        
        UserStats userStats = loadUserStats(score);
        
        if (userStats == null) {
            tags.add("type:no-stats");
            return null;
        }
        
        if (item.getProcessHistory() != null) {
            tags.add("type:upgraded");
            int previousVersion = item.getProcessHistory().getProcessedVersion();
            
            for (ScoreProcessor processor : processors) {
                processor.revertFromUserStats(score, userStats, previousVersion);
            }
        } else {
            tags.add("type:new");
        }
        
        for (ScoreProcessor processor : processors) {
            long start = System.nanoTime();
            processor.applyToUserStats(score, userStats);
            logger.debug("apply-{} took {}ms - tags: {}", processor.getName(), (System.nanoTime() - start) / 1_000_000, tags);
        }
        
        userStats.setLastUpdate(Instant.now(clock));
        userStatsRepository.save(userStats);
        
        ProcessHistory history = item.toProcessedHistory(VERSION, Instant.now(clock));
        processHistoryRepository.save(history);
        return history;
    }
    
    /**
     * Loads the user's statistics, starting empty ones for a supported ruleset.
     *
     * @return null when the ruleset has no statistics
     */
    private UserStats loadUserStats(Score score) {
        if (!Ruleset.isSupported(score.getRulesetId())) {
            return null;
        }
        
        return userStatsRepository.find(score.getUserId(), score.getRulesetId())
            .orElseGet(() -> UserStats.builder()
                .userId(score.getUserId())
                .rulesetId(score.getRulesetId())
                .build());
    }
    
    private void runPostCommitEffects(Score score, List<ScoreProcessor> processors, ProcessHistory history) {
        if (score.isPassed()) {
            try {
                // All passing scores are preserved for now.
                scoreRepository.markPreserved(score.getId());
                score.setPreserve(true);
            } catch (Exception e) {
                logger.warn("Failed to mark score {} as preserved", score.getId(), e);
            }
        }
        
        for (ScoreProcessor processor : processors) {
            try {
                processor.applyGlobal(score);
            } catch (Exception e) {
                logger.warn("Global update of {} failed for score {}", processor.getName(), score.getId(), e);
            }
        }
        
        pushToIndexQueue(score);
        publishScoreProcessed(history);
    }
    
    private void pushToIndexQueue(Score score) {
        try {
            queueRepository.push(indexQueue, objectMapper.writeValueAsString(Map.of("ScoreId", score.getId())));
        } catch (Exception e) {
            logger.warn("Failed to push score {} to index queue {}", score.getId(), indexQueue, e);
        }
    }
    
    private void publishScoreProcessed(ProcessHistory history) {
        try {
            ScoreProcessedMessage message = new ScoreProcessedMessage(history.getScoreId(), history.getProcessedVersion());
            queueRepository.publish(processedChannel, objectMapper.writeValueAsString(message));
        } catch (Exception e) {
            logger.warn("Error publishing score processed event for score {}", history.getScoreId(), e);
        }
    }
}
