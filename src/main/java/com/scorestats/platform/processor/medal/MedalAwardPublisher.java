package com.scorestats.platform.processor.medal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorestats.platform.repository.QueueRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forwards medal awards to a Redis channel so other services can notify the user.
 */
@Component
public class MedalAwardPublisher implements MedalAwardListener {
    
    private static final Logger logger = LoggerFactory.getLogger(MedalAwardPublisher.class);
    
    private final MedalAwardNotifier notifier;
    private final QueueRepository queueRepository;
    private final String channel;
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    @Autowired
    public MedalAwardPublisher(
            MedalAwardNotifier notifier,
            QueueRepository queueRepository,
            @Value("${score-statistics.events.medal-awarded-channel:osu-channel:medal:awarded}") String channel) {
        this.notifier = notifier;
        this.queueRepository = queueRepository;
        this.channel = channel;
    }
    
    @PostConstruct
    public void register() {
        notifier.addListener(this);
    }
    
    @PreDestroy
    public void unregister() {
        notifier.removeListener(this);
    }
    
    @Override
    public void onMedalAwarded(AwardedMedal awardedMedal) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", awardedMedal.getUserId());
        payload.put("achievement_id", awardedMedal.getMedalId());
        payload.put("score_id", awardedMedal.getScore().getId());
        
        try {
            queueRepository.publish(channel, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize medal award for user {}", awardedMedal.getUserId(), e);
        } catch (Exception e) {
            logger.warn("Failed to publish medal award - userId: {}, medalId: {}, error: {}",
                awardedMedal.getUserId(), awardedMedal.getMedalId(), e.getMessage());
        }
    }
}
