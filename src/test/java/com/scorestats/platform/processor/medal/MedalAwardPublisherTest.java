package com.scorestats.platform.processor.medal;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.repository.QueueRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MedalAwardPublisherTest {
    
    private static final String CHANNEL = "osu-channel:medal:awarded";
    
    @Mock
    private QueueRepository queueRepository;
    
    private MedalAwardNotifier notifier;
    private MedalAwardPublisher publisher;
    private AwardedMedal awardedMedal;
    
    @BeforeEach
    void setUp() {
        notifier = new MedalAwardNotifier();
        publisher = new MedalAwardPublisher(notifier, queueRepository, CHANNEL);
        awardedMedal = new AwardedMedal(
            Medal.builder().achievementId(12).slug("all-packs-1").build(),
            Score.builder().id(99L).userId(3).build());
    }
    
    @Test
    void testRegister_PublishesAwardsDeliveredByNotifier() {
        // Arrange
        publisher.register();
        
        // Act
        notifier.notifyAwarded(awardedMedal);
        
        // Assert
        verify(queueRepository).publish(CHANNEL, "{\"user_id\":3,\"achievement_id\":12,\"score_id\":99}");
    }
    
    @Test
    void testUnregister_StopsPublishing() {
        // Arrange
        publisher.register();
        publisher.unregister();
        
        // Act
        notifier.notifyAwarded(awardedMedal);
        
        // Assert
        verifyNoInteractions(queueRepository);
    }
    
    @Test
    void testOnMedalAwarded_PublishFailureIsNotPropagated() {
        // Arrange
        doThrow(new IllegalStateException("redis down")).when(queueRepository).publish(anyString(), anyString());
        
        // Act & Assert
        assertDoesNotThrow(() -> publisher.onMedalAwarded(awardedMedal));
    }
}
