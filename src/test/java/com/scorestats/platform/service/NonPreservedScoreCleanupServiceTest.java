package com.scorestats.platform.service;

import com.scorestats.platform.repository.ScoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NonPreservedScoreCleanupServiceTest {
    
    private static final Instant NOW = Instant.parse("2024-05-03T00:00:00Z");
    private static final Instant CUTOFF = Instant.parse("2024-05-01T00:00:00Z");
    
    @Mock
    private ScoreRepository scoreRepository;
    
    private BatchJobTracker jobTracker;
    private NonPreservedScoreCleanupService service;
    
    @BeforeEach
    void setUp() {
        jobTracker = new BatchJobTracker();
        service = new NonPreservedScoreCleanupService(scoreRepository, jobTracker, Clock.fixed(NOW, ZoneOffset.UTC), 48);
    }
    
    @Test
    void testDeleteStaleScores_DeletesEveryPageBeforeCutoff() {
        // Arrange
        when(scoreRepository.findNonPreservedScoreIdsUpdatedBefore(eq(CUTOFF), anyInt()))
            .thenReturn(List.of(1L, 2L, 3L), List.of(4L), List.of());
        
        // Act
        BatchResult result = service.deleteStaleScores();
        
        // Assert
        assertEquals(4, result.getProcessed());
        assertFalse(result.isCancelled());
        verify(scoreRepository).deleteById(1L);
        verify(scoreRepository).deleteById(4L);
        verify(scoreRepository, times(3)).findNonPreservedScoreIdsUpdatedBefore(eq(CUTOFF), anyInt());
    }
    
    @Test
    void testDeleteStaleScores_NothingToDelete() {
        // Arrange
        when(scoreRepository.findNonPreservedScoreIdsUpdatedBefore(eq(CUTOFF), anyInt())).thenReturn(List.of());
        
        // Act
        BatchResult result = service.deleteStaleScores();
        
        // Assert
        assertEquals(0, result.getProcessed());
        verify(scoreRepository, never()).deleteById(anyLong());
    }
    
    @Test
    @MockitoSettings(strictness = Strictness.LENIENT)
    void testDeleteStaleScores_StopsBetweenScoresWhenCancelled() {
        // Arrange
        CancellationSignal signal = new CancellationSignal();
        when(scoreRepository.findNonPreservedScoreIdsUpdatedBefore(eq(CUTOFF), anyInt())).thenReturn(List.of(1L, 2L, 3L));
        doAnswer(invocation -> {
            signal.cancel();
            return null;
        }).when(scoreRepository).deleteById(2L);
        
        // Act
        BatchResult result = service.deleteStaleScores(signal);
        
        // Assert
        assertEquals(2, result.getProcessed());
        assertTrue(result.isCancelled());
        verify(scoreRepository, never()).deleteById(3L);
    }
    
    @Test
    void testDeleteStaleScores_CancelledThroughTracker() {
        // Arrange
        when(scoreRepository.findNonPreservedScoreIdsUpdatedBefore(eq(CUTOFF), anyInt())).thenReturn(List.of(1L, 2L));
        doAnswer(invocation -> {
            jobTracker.cancelAll();
            return null;
        }).when(scoreRepository).deleteById(1L);
        
        // Act
        BatchResult result = service.deleteStaleScores();
        
        // Assert
        assertEquals(1, result.getProcessed());
        assertTrue(result.isCancelled());
        assertEquals(0, jobTracker.cancelAll());
    }
}
