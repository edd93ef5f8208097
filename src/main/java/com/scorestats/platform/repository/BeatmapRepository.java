package com.scorestats.platform.repository;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.BeatmapDifficultyAttribute;
import com.scorestats.platform.model.PerformanceBlacklistEntry;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BeatmapRepository {
    Optional<Beatmap> findById(int beatmapId);
    List<Beatmap> findByBeatmapsetIds(Collection<Integer> beatmapsetIds);
    List<PerformanceBlacklistEntry> findPerformanceBlacklist();
    List<BeatmapDifficultyAttribute> findDifficultyAttributes(int beatmapId, int rulesetId, int legacyModValue);
}
