package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.BeatmapPackItem;
import com.scorestats.platform.model.BeatmapPackItemId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BeatmapPackItemJpaRepository extends JpaRepository<BeatmapPackItem, BeatmapPackItemId> {
    List<BeatmapPackItem> findByPackId(int packId);
}
