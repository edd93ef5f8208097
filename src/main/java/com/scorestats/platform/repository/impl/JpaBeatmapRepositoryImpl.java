package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.BeatmapDifficultyAttribute;
import com.scorestats.platform.model.PerformanceBlacklistEntry;
import com.scorestats.platform.repository.BeatmapRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaBeatmapRepositoryImpl implements BeatmapRepository {
    
    private final BeatmapJpaRepository beatmapRepository;
    private final PerformanceBlacklistJpaRepository blacklistRepository;
    private final DifficultyAttributeJpaRepository attributeRepository;
    
    @Autowired
    public JpaBeatmapRepositoryImpl(
            BeatmapJpaRepository beatmapRepository,
            PerformanceBlacklistJpaRepository blacklistRepository,
            DifficultyAttributeJpaRepository attributeRepository) {
        this.beatmapRepository = beatmapRepository;
        this.blacklistRepository = blacklistRepository;
        this.attributeRepository = attributeRepository;
    }
    
    @Override
    public Optional<Beatmap> findById(int beatmapId) {
        return beatmapRepository.findById(beatmapId);
    }
    
    @Override
    public List<Beatmap> findByBeatmapsetIds(Collection<Integer> beatmapsetIds) {
        if (beatmapsetIds.isEmpty()) {
            return List.of();
        }
        return beatmapRepository.findByBeatmapsetIdIn(beatmapsetIds);
    }
    
    @Override
    public List<PerformanceBlacklistEntry> findPerformanceBlacklist() {
        return blacklistRepository.findAll();
    }
    
    @Override
    public List<BeatmapDifficultyAttribute> findDifficultyAttributes(int beatmapId, int rulesetId, int legacyModValue) {
        return attributeRepository.findByBeatmapIdAndModeAndMods(beatmapId, rulesetId, legacyModValue);
    }
}
