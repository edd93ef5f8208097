package com.scorestats.platform.processor;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.BeatmapOnlineStatus;
import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.ScoreRank;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Reprocessing a score at the version it was applied under must leave the statistics as they were.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RevertApplyInverseTest {
    
    private static final int CURRENT_VERSION = 11;
    private static final Instant ENDED_AT = Instant.parse("2024-03-01T12:00:00Z");
    
    @Mock
    private BeatmapStore beatmapStore;
    
    @Mock
    private ScoreRepository scoreRepository;
    
    private Score score;
    private UserStats initial;
    
    @BeforeEach
    void setUp() {
        when(beatmapStore.getBeatmap(10)).thenReturn(Optional.of(Beatmap.builder()
            .beatmapId(10)
            .beatmapsetId(1)
            .approved(BeatmapOnlineStatus.RANKED)
            .totalLength(100)
            .build()));
        
        score = Score.builder()
            .id(5L)
            .userId(2)
            .beatmapId(10)
            .rulesetId(0)
            .passed(true)
            .totalScore(700_000)
            .maxCombo(512)
            .rank(ScoreRank.SH)
            .statistics(Map.of("great", 400, "miss", 2))
            .mods(List.of(new Mod("DT"), new Mod("HD")))
            .startedAt(ENDED_AT.minusSeconds(200))
            .endedAt(ENDED_AT)
            .build();
        
        initial = UserStats.builder()
            .userId(2)
            .rulesetId(0)
            .playCount(40)
            .playTime(3600)
            .totalScore(10_000_000)
            .totalHits(20_000)
            .rankedScore(5_000_000)
            .shRankCount(4)
            .sRankCount(3)
            .maxCombo(300)
            .build();
    }
    
    @Test
    void testPlayCountProcessor() {
        assertReprocessingIsNoOp(new PlayCountProcessor());
    }
    
    @Test
    void testPlayTimeProcessor() {
        assertReprocessingIsNoOp(new PlayTimeProcessor(beatmapStore));
    }
    
    @Test
    void testPlayTimeProcessor_BoundedByRateAdjustedLength() {
        // Arrange
        PlayTimeProcessor processor = new PlayTimeProcessor(beatmapStore);
        
        // Act & Assert
        // 100 seconds at 1.5x, rounded up.
        assertEquals(67, processor.getPlayLength(score));
    }
    
    @Test
    void testTotalScoreProcessor() {
        assertReprocessingIsNoOp(new TotalScoreProcessor());
    }
    
    @Test
    void testMaxComboProcessor() {
        assertReprocessingIsNoOp(new MaxComboProcessor(beatmapStore));
    }
    
    @Test
    void testRankedScoreProcessor_WithoutPreviousBest() {
        when(scoreRepository.findProcessedRankedPassedScores(2, 10, 0)).thenReturn(List.of(score));
        assertReprocessingIsNoOp(new RankedScoreProcessor(scoreRepository, beatmapStore));
    }
    
    @Test
    void testRankedScoreProcessor_ReplacingPreviousBest() {
        Score previous = Score.builder().id(3L).userId(2).beatmapId(10).passed(true).totalScore(600_000).rank(ScoreRank.A).build();
        when(scoreRepository.findProcessedRankedPassedScores(2, 10, 0)).thenReturn(List.of(previous, score));
        assertReprocessingIsNoOp(new RankedScoreProcessor(scoreRepository, beatmapStore));
    }
    
    @Test
    void testUserRankCountProcessor_ReplacingPreviousBest() {
        Score previous = Score.builder().id(3L).userId(2).beatmapId(10).passed(true).totalScore(600_000).rank(ScoreRank.S).build();
        when(scoreRepository.findProcessedRankedPassedScores(2, 10, 0)).thenReturn(List.of(previous, score));
        assertReprocessingIsNoOp(new UserRankCountProcessor(scoreRepository, beatmapStore));
    }
    
    @Test
    void testUserRankCountProcessor_NotBeatingPreviousBest() {
        // Arrange
        Score previous = Score.builder().id(3L).userId(2).beatmapId(10).passed(true).totalScore(900_000).rank(ScoreRank.X).build();
        when(scoreRepository.findProcessedRankedPassedScores(2, 10, 0)).thenReturn(List.of(previous, score));
        UserRankCountProcessor processor = new UserRankCountProcessor(scoreRepository, beatmapStore);
        UserStats stats = initial.copy();
        
        // Act
        processor.applyToUserStats(score, stats);
        
        // Assert
        assertEquals(initial, stats);
    }
    
    @Test
    void testPlayCountProcessor_InvalidPlayRevertedUnderOldVersion() {
        // Arrange
        PlayCountProcessor processor = new PlayCountProcessor();
        score.setStatistics(Map.of("miss", 10));
        UserStats stats = initial.copy();
        
        // Act
        // Before version 10 every play was counted, so it has to come off.
        processor.revertFromUserStats(score, stats, 9);
        processor.applyToUserStats(score, stats);
        
        // Assert
        assertEquals(initial.getPlayCount() - 1, stats.getPlayCount());
    }
    
    @Test
    void testTotalScoreProcessor_InvalidPlayNotRevertedUnderCurrentVersion() {
        // Arrange
        TotalScoreProcessor processor = new TotalScoreProcessor();
        score.setStatistics(Map.of("miss", 10));
        UserStats stats = initial.copy();
        
        // Act
        processor.revertFromUserStats(score, stats, CURRENT_VERSION);
        processor.applyToUserStats(score, stats);
        
        // Assert
        assertEquals(initial, stats);
    }
    
    private void assertReprocessingIsNoOp(ScoreProcessor processor) {
        UserStats applied = initial.copy();
        processor.applyToUserStats(score, applied);
        
        UserStats reprocessed = applied.copy();
        processor.revertFromUserStats(score, reprocessed, CURRENT_VERSION);
        processor.applyToUserStats(score, reprocessed);
        
        assertEquals(applied, reprocessed);
        assertNotEquals(initial, applied, "Processor did not change anything");
    }
}
