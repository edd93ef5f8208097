package com.scorestats.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Membership of a beatmap set in a beatmap pack.
 */
@Entity
@Table(name = "osu_beatmappacks_items")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(BeatmapPackItemId.class)
public class BeatmapPackItem {
    @Id
    @Column(name = "pack_id", nullable = false)
    private int packId;
    
    @Id
    @Column(name = "beatmapset_id", nullable = false)
    private int beatmapsetId;
}
