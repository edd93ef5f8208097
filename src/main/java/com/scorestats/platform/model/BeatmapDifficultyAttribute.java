package com.scorestats.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One precomputed difficulty attribute of a beatmap under a legacy mod combination.
 */
@Entity
@Table(name = "osu_beatmap_difficulty_attribs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(BeatmapDifficultyAttributeId.class)
public class BeatmapDifficultyAttribute {
    @Id
    @Column(name = "beatmap_id", nullable = false)
    private int beatmapId;
    
    @Id
    @Column(name = "mode", nullable = false)
    private int mode;
    
    @Id
    @Column(name = "mods", nullable = false)
    private int mods;
    
    @Id
    @Column(name = "attrib_id", nullable = false)
    private int attribId;
    
    @Column(name = "value", nullable = false)
    private double value;
}
