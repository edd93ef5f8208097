package com.scorestats.platform.calculation;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.Ruleset;

import java.util.List;
import java.util.Optional;

/**
 * Computes difficulty attributes from beatmap content. Implementations live outside this service.
 */
public interface DifficultyCalculator {
    Optional<DifficultyAttributes> computeDifficulty(Beatmap beatmap, Ruleset ruleset, List<Mod> mods);
}
