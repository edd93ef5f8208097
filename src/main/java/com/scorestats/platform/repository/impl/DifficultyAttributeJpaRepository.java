package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.BeatmapDifficultyAttribute;
import com.scorestats.platform.model.BeatmapDifficultyAttributeId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DifficultyAttributeJpaRepository extends JpaRepository<BeatmapDifficultyAttribute, BeatmapDifficultyAttributeId> {
    List<BeatmapDifficultyAttribute> findByBeatmapIdAndModeAndMods(int beatmapId, int mode, int mods);
}
