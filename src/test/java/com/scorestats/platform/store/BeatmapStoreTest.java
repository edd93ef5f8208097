package com.scorestats.platform.store;

import com.scorestats.platform.calculation.DifficultyAttributes;
import com.scorestats.platform.calculation.DifficultyCalculator;
import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.BeatmapDifficultyAttribute;
import com.scorestats.platform.model.BeatmapOnlineStatus;
import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.PerformanceBlacklistEntry;
import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.repository.BeatmapRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BeatmapStoreTest {
    
    private static final long REFRESH_INTERVAL_MS = 60_000;
    
    @Mock
    private BeatmapRepository beatmapRepository;
    
    @Mock
    private ObjectProvider<DifficultyCalculator> calculatorProvider;
    
    @Mock
    private DifficultyCalculator difficultyCalculator;
    
    @Mock
    private Clock clock;
    
    private BeatmapStore createStore(boolean realtime) {
        return new BeatmapStore(beatmapRepository, calculatorProvider, new StoreSettings(REFRESH_INTERVAL_MS, realtime), clock);
    }
    
    @Test
    void testGetBeatmap_MemoizesMisses() {
        // Arrange
        when(clock.millis()).thenReturn(1_000L);
        when(beatmapRepository.findById(404)).thenReturn(Optional.empty());
        BeatmapStore store = createStore(false);
        
        // Act
        Optional<Beatmap> first = store.getBeatmap(404);
        Optional<Beatmap> second = store.getBeatmap(404);
        
        // Assert
        assertTrue(first.isEmpty());
        assertTrue(second.isEmpty());
        verify(beatmapRepository, times(1)).findById(404);
    }
    
    @Test
    void testGetBeatmap_ReloadsAfterRefreshInterval() {
        // Arrange
        Beatmap pending = Beatmap.builder().beatmapId(10).approved(BeatmapOnlineStatus.PENDING).build();
        Beatmap ranked = Beatmap.builder().beatmapId(10).approved(BeatmapOnlineStatus.RANKED).build();
        when(clock.millis()).thenReturn(1_000L, 1_000L + REFRESH_INTERVAL_MS, 2_000L + REFRESH_INTERVAL_MS);
        when(beatmapRepository.findById(10)).thenReturn(Optional.of(pending), Optional.of(ranked));
        BeatmapStore store = createStore(false);
        
        // Act
        Optional<Beatmap> initial = store.getBeatmap(10);
        Optional<Beatmap> withinInterval = store.getBeatmap(10);
        Optional<Beatmap> afterInterval = store.getBeatmap(10);
        
        // Assert
        assertEquals(BeatmapOnlineStatus.PENDING, initial.get().getApproved());
        assertEquals(BeatmapOnlineStatus.PENDING, withinInterval.get().getApproved());
        assertEquals(BeatmapOnlineStatus.RANKED, afterInterval.get().getApproved());
        verify(beatmapRepository, times(2)).findPerformanceBlacklist();
    }
    
    @Test
    void testIsBeatmapValidForPerformance_BlacklistIsPerRuleset() {
        // Arrange
        when(clock.millis()).thenReturn(1_000L);
        when(beatmapRepository.findPerformanceBlacklist()).thenReturn(List.of(
            PerformanceBlacklistEntry.builder().beatmapId(10).mode(0).build()));
        BeatmapStore store = createStore(false);
        Beatmap beatmap = Beatmap.builder().beatmapId(10).approved(BeatmapOnlineStatus.RANKED).build();
        
        // Act & Assert
        assertFalse(store.isBeatmapValidForPerformance(beatmap, 0));
        assertTrue(store.isBeatmapValidForPerformance(beatmap, 1));
    }
    
    @Test
    void testIsBeatmapValidForPerformance_OnlyRankedAndApproved() {
        // Arrange
        when(clock.millis()).thenReturn(1_000L);
        BeatmapStore store = createStore(false);
        
        // Act & Assert
        for (BeatmapOnlineStatus status : BeatmapOnlineStatus.values()) {
            Beatmap beatmap = Beatmap.builder().beatmapId(10).approved(status).build();
            boolean expected = status == BeatmapOnlineStatus.RANKED || status == BeatmapOnlineStatus.APPROVED;
            assertEquals(expected, store.isBeatmapValidForPerformance(beatmap, 0), status.name());
        }
    }
    
    @Test
    void testGetDifficultyAttributes_KeysStoredRowsByRelevantMods() {
        // Arrange
        when(clock.millis()).thenReturn(1_000L);
        when(beatmapRepository.findDifficultyAttributes(10, 0, 64)).thenReturn(List.of(
            BeatmapDifficultyAttribute.builder().beatmapId(10).mode(0).mods(64).attribId(DifficultyAttributes.STAR_RATING).value(6.1).build(),
            BeatmapDifficultyAttribute.builder().beatmapId(10).mode(0).mods(64).attribId(DifficultyAttributes.MAX_COMBO).value(900).build()));
        BeatmapStore store = createStore(false);
        Beatmap beatmap = Beatmap.builder().beatmapId(10).playmode(0).build();
        
        // Act
        // Hidden does not affect stored attributes without flashlight.
        Optional<DifficultyAttributes> withHidden = store.getDifficultyAttributes(beatmap, Ruleset.OSU, List.of(new Mod("DT"), new Mod("HD")));
        Optional<DifficultyAttributes> withoutHidden = store.getDifficultyAttributes(beatmap, Ruleset.OSU, List.of(new Mod("DT")));
        
        // Assert
        assertEquals(6.1, withHidden.get().get(DifficultyAttributes.STAR_RATING).getAsDouble());
        assertEquals(withHidden, withoutHidden);
        verify(beatmapRepository, times(1)).findDifficultyAttributes(anyInt(), anyInt(), anyInt());
    }
    
    @Test
    void testGetDifficultyAttributes_MissingRowsGiveEmpty() {
        // Arrange
        when(clock.millis()).thenReturn(1_000L);
        when(beatmapRepository.findDifficultyAttributes(10, 1, 0)).thenReturn(List.of());
        BeatmapStore store = createStore(false);
        Beatmap beatmap = Beatmap.builder().beatmapId(10).playmode(0).build();
        
        // Act & Assert
        assertTrue(store.getDifficultyAttributes(beatmap, Ruleset.TAIKO, List.of()).isEmpty());
    }
    
    @Test
    void testGetDifficultyAttributes_RealtimeUsesCalculator() {
        // Arrange
        when(clock.millis()).thenReturn(1_000L);
        when(calculatorProvider.getIfAvailable()).thenReturn(difficultyCalculator);
        Beatmap beatmap = Beatmap.builder().beatmapId(10).playmode(0).build();
        DifficultyAttributes computed = new DifficultyAttributes(0, Map.of(DifficultyAttributes.STAR_RATING, 4.0));
        when(difficultyCalculator.computeDifficulty(eq(beatmap), eq(Ruleset.OSU), anyList())).thenReturn(Optional.of(computed));
        BeatmapStore store = createStore(true);
        
        // Act
        Optional<DifficultyAttributes> first = store.getDifficultyAttributes(beatmap, Ruleset.OSU, List.of());
        Optional<DifficultyAttributes> second = store.getDifficultyAttributes(beatmap, Ruleset.OSU, List.of());
        
        // Assert
        assertEquals(Optional.of(computed), first);
        assertEquals(first, second);
        verify(difficultyCalculator, times(1)).computeDifficulty(any(), any(), anyList());
        verify(beatmapRepository, never()).findDifficultyAttributes(anyInt(), anyInt(), anyInt());
    }
}
