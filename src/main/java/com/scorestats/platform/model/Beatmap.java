package com.scorestats.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference data for a single difficulty. Read only.
 */
@Entity
@Table(name = "osu_beatmaps", indexes = {
    @Index(name = "idx_beatmaps_beatmapset", columnList = "beatmapset_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Beatmap {
    @Id
    @Column(name = "beatmap_id")
    private int beatmapId;
    
    @Column(name = "beatmapset_id", nullable = false)
    private int beatmapsetId;
    
    @Convert(converter = BeatmapOnlineStatusConverter.class)
    @Column(name = "approved", nullable = false)
    @Builder.Default
    private BeatmapOnlineStatus approved = BeatmapOnlineStatus.PENDING;
    
    /**
     * Ruleset the beatmap was authored for.
     */
    @Column(name = "playmode", nullable = false)
    private int playmode;
    
    /**
     * Seconds.
     */
    @Column(name = "total_length", nullable = false)
    private int totalLength;
    
    @Column(name = "max_combo")
    private Integer maxCombo;
    
    public boolean isRankedOrApproved() {
        return approved == BeatmapOnlineStatus.RANKED || approved == BeatmapOnlineStatus.APPROVED;
    }
}
