package com.scorestats.platform.calculation;

import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.Score;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModUtilsTest {
    
    @Test
    void testToLegacyMods_CombinesImpliedBits() {
        assertEquals(ModUtils.NIGHTCORE | ModUtils.DOUBLE_TIME | ModUtils.HIDDEN,
            ModUtils.toLegacyMods(List.of(new Mod("NC"), new Mod("HD"))));
        assertEquals(0, ModUtils.toLegacyMods(List.of(new Mod("DA"))));
    }
    
    @Test
    void testMaskRelevantMods_OsuKeepsHiddenOnlyWithFlashlight() {
        int hiddenOnly = ModUtils.HIDDEN | ModUtils.HARD_ROCK;
        int hiddenFlashlight = ModUtils.HIDDEN | ModUtils.FLASHLIGHT;
        
        assertEquals(ModUtils.HARD_ROCK, ModUtils.maskRelevantMods(hiddenOnly, false, 0));
        assertEquals(hiddenFlashlight, ModUtils.maskRelevantMods(hiddenFlashlight, false, 0));
    }
    
    @Test
    void testMaskRelevantMods_ManiaKeepsKeyModsOnConverts() {
        int mods = ModUtils.KEY4 | ModUtils.DOUBLE_TIME;
        
        assertEquals(mods, ModUtils.maskRelevantMods(mods, true, 3));
        assertEquals(ModUtils.DOUBLE_TIME, ModUtils.maskRelevantMods(mods, false, 3));
    }
    
    @Test
    void testContainsDifficultyReduction() {
        assertTrue(ModUtils.containsDifficultyReduction(List.of(new Mod("HD"), new Mod("EZ"))));
        assertTrue(ModUtils.containsDifficultyReduction(List.of(new Mod("HT"))));
        assertFalse(ModUtils.containsDifficultyReduction(List.of(new Mod("DT"), new Mod("HR"))));
    }
    
    @Test
    void testAllModsValidForPerformance_RulesetSpecificMods() {
        Score osu = Score.builder().rulesetId(0).build();
        Score mania = Score.builder().rulesetId(3).build();
        
        assertTrue(ModUtils.allModsValidForPerformance(osu, List.of(new Mod("SO"), new Mod("HD"))));
        assertFalse(ModUtils.allModsValidForPerformance(mania, List.of(new Mod("SO"))));
        assertTrue(ModUtils.allModsValidForPerformance(mania, List.of(new Mod("7K"), new Mod("MR"))));
        assertFalse(ModUtils.allModsValidForPerformance(mania, List.of(new Mod("HR"))));
    }
    
    @Test
    void testAllModsValidForPerformance_ClassicOnlyOnLegacyScores() {
        Score legacy = Score.builder().rulesetId(0).legacyScoreId(1L).build();
        Score current = Score.builder().rulesetId(0).build();
        
        assertTrue(ModUtils.allModsValidForPerformance(legacy, List.of(new Mod("CL"))));
        assertFalse(ModUtils.allModsValidForPerformance(current, List.of(new Mod("CL"))));
    }
    
    @Test
    void testAllModsValidForPerformance_RejectsCustomSettings() {
        Score score = Score.builder().rulesetId(0).build();
        
        assertFalse(ModUtils.allModsValidForPerformance(score, List.of(new Mod("DT", Map.of("speed_change", 1.3)))));
    }
}
