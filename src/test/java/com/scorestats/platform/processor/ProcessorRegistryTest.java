package com.scorestats.platform.processor;

import com.scorestats.platform.exception.ProcessorConfigurationException;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorRegistryTest {
    
    @Test
    void testProcessors_SortedByOrderKeepingRegistrationOrderForTies() {
        // Arrange
        List<ScoreProcessor> registered = List.of(
            new NamedProcessor("medals", 100, false, false),
            new NamedProcessor("play-count", 10, true, false),
            new NamedProcessor("total-score", 10, true, false),
            new NamedProcessor("performance", 0, false, true)
        );
        
        // Act
        ProcessorRegistry registry = new ProcessorRegistry(registered, List.of());
        
        // Assert
        assertEquals(List.of("performance", "play-count", "total-score", "medals"), names(registry.getProcessors()));
    }
    
    @Test
    void testDisabledProcessors_AreRemoved() {
        // Arrange
        List<ScoreProcessor> registered = List.of(
            new NamedProcessor("play-count", 10, true, false),
            new NamedProcessor("medals", 100, false, false)
        );
        
        // Act
        ProcessorRegistry registry = new ProcessorRegistry(registered, List.of(" medals ", ""));
        
        // Assert
        assertEquals(List.of("play-count"), names(registry.getProcessors()));
    }
    
    @Test
    void testDisabledProcessors_UnknownNameFails() {
        // Arrange
        List<ScoreProcessor> registered = List.of(new NamedProcessor("play-count", 10, true, false));
        
        // Act & Assert
        assertThrows(ProcessorConfigurationException.class, () -> new ProcessorRegistry(registered, List.of("missing")));
    }
    
    @Test
    void testEligibleProcessors_FilterFailedAndLegacyScores() {
        // Arrange
        ProcessorRegistry registry = new ProcessorRegistry(List.of(
            new NamedProcessor("passed-only", 0, false, false),
            new NamedProcessor("failed-too", 1, true, false),
            new NamedProcessor("legacy-too", 2, false, true),
            new NamedProcessor("everything", 3, true, true)
        ), List.of());
        
        Score passed = Score.builder().id(1L).passed(true).build();
        Score failed = Score.builder().id(2L).passed(false).build();
        Score legacyPassed = Score.builder().id(3L).passed(true).legacyScoreId(9L).build();
        Score legacyFailed = Score.builder().id(4L).passed(false).legacyScoreId(9L).build();
        
        // Act & Assert
        assertEquals(List.of("passed-only", "failed-too", "legacy-too", "everything"), names(registry.getEligibleProcessors(passed)));
        assertEquals(List.of("failed-too", "everything"), names(registry.getEligibleProcessors(failed)));
        assertEquals(List.of("legacy-too", "everything"), names(registry.getEligibleProcessors(legacyPassed)));
        assertEquals(List.of("everything"), names(registry.getEligibleProcessors(legacyFailed)));
    }
    
    private static List<String> names(List<ScoreProcessor> processors) {
        return processors.stream().map(ScoreProcessor::getName).toList();
    }
    
    private static class NamedProcessor implements ScoreProcessor {
        private final String name;
        private final int order;
        private final boolean onFailed;
        private final boolean onLegacy;
        
        NamedProcessor(String name, int order, boolean onFailed, boolean onLegacy) {
            this.name = name;
            this.order = order;
            this.onFailed = onFailed;
            this.onLegacy = onLegacy;
        }
        
        @Override
        public String getName() {
            return name;
        }
        
        @Override
        public int getOrder() {
            return order;
        }
        
        @Override
        public boolean runOnFailedScores() {
            return onFailed;
        }
        
        @Override
        public boolean runOnLegacyScores() {
            return onLegacy;
        }
        
        @Override
        public void applyToUserStats(Score score, UserStats userStats) {
        }
        
        @Override
        public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
        }
        
        @Override
        public void applyGlobal(Score score) {
        }
    }
}
