package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate statistics of one user in one ruleset.
 */
@Entity
@Table(name = "user_stats")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@IdClass(UserStatsId.class)
public class UserStats {
    @Id
    @Column(name = "user_id", nullable = false)
    private int userId;
    
    @Id
    @Column(name = "ruleset_id", nullable = false)
    private int rulesetId;
    
    @Column(name = "total_score", nullable = false)
    private long totalScore;
    
    @Column(name = "ranked_score", nullable = false)
    private long rankedScore;
    
    @Column(name = "playcount", nullable = false)
    private int playCount;
    
    /**
     * Seconds.
     */
    @Column(name = "total_seconds_played", nullable = false)
    private long playTime;
    
    @Column(name = "max_combo", nullable = false)
    private int maxCombo;
    
    @Column(name = "total_hits", nullable = false)
    private long totalHits;
    
    @Column(name = "x_rank_count", nullable = false)
    private int xRankCount;
    
    @Column(name = "xh_rank_count", nullable = false)
    private int xhRankCount;
    
    @Column(name = "s_rank_count", nullable = false)
    private int sRankCount;
    
    @Column(name = "sh_rank_count", nullable = false)
    private int shRankCount;
    
    @Column(name = "a_rank_count", nullable = false)
    private int aRankCount;
    
    @Column(name = "rank_score", nullable = false)
    private double performance;
    
    @Column(name = "accuracy_new", nullable = false)
    private double accuracy;
    
    @Column(name = "last_update")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastUpdate;
    
    /**
     * Adds {@code delta} to the counter tracking {@code rank}. Grades below A are not tracked.
     */
    public void adjustRankCount(ScoreRank rank, int delta) {
        switch (rank) {
            case XH -> xhRankCount += delta;
            case X -> xRankCount += delta;
            case SH -> shRankCount += delta;
            case S -> sRankCount += delta;
            case A -> aRankCount += delta;
            default -> {
            }
        }
    }
    
    public UserStats copy() {
        return toBuilder().build();
    }
}
