package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Beatmap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface BeatmapJpaRepository extends JpaRepository<Beatmap, Integer> {
    List<Beatmap> findByBeatmapsetIdIn(Collection<Integer> beatmapsetIds);
}
