package com.scorestats.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A (beatmap, ruleset) pair which never awards performance.
 */
@Entity
@Table(name = "osu_beatmap_performance_blacklist")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(PerformanceBlacklistEntryId.class)
public class PerformanceBlacklistEntry {
    @Id
    @Column(name = "beatmap_id", nullable = false)
    private int beatmapId;
    
    @Id
    @Column(name = "mode", nullable = false)
    private int mode;
}
