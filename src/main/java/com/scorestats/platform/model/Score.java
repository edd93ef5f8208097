package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A submitted score. Owned by the submission system; processing only reads it and writes back
 * the computed performance value, the ranked flag and the preserve flag.
 */
@Entity
@Table(name = "scores", indexes = {
    @Index(name = "idx_scores_user_ruleset", columnList = "user_id,ruleset_id"),
    @Index(name = "idx_scores_user_beatmap", columnList = "user_id,beatmap_id"),
    @Index(name = "idx_scores_preserve_updated", columnList = "preserve,updated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Score {
    
    private static final Set<String> MISS_RESULTS = Set.of("miss", "large_tick_miss", "small_tick_miss", "ignore_miss");
    
    @Id
    @Column(name = "id")
    private Long id;
    
    @Column(name = "user_id", nullable = false)
    private int userId;
    
    @Column(name = "beatmap_id", nullable = false)
    private int beatmapId;
    
    @Column(name = "ruleset_id", nullable = false)
    private int rulesetId;
    
    @Column(name = "passed", nullable = false)
    private boolean passed;
    
    @Column(name = "total_score", nullable = false)
    private long totalScore;
    
    @Column(name = "accuracy", nullable = false)
    private double accuracy;
    
    @Column(name = "max_combo", nullable = false)
    private int maxCombo;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "rank", nullable = false)
    @Builder.Default
    private ScoreRank rank = ScoreRank.F;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "statistics", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Integer> statistics = new HashMap<>();
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "mods", columnDefinition = "jsonb")
    @Builder.Default
    private List<Mod> mods = new ArrayList<>();
    
    @Column(name = "legacy_score_id")
    private Long legacyScoreId;
    
    @Column(name = "build_id")
    private Integer buildId;
    
    @Column(name = "pp")
    private Double pp;
    
    @Column(name = "ranked", nullable = false)
    @Builder.Default
    private boolean ranked = true;
    
    @Column(name = "preserve", nullable = false)
    private boolean preserve;
    
    @Column(name = "started_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant startedAt;
    
    @Column(name = "ended_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant endedAt;
    
    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;
    
    /**
     * The beatmap this score was set on, attached while the score is being processed.
     */
    @Transient
    @JsonIgnore
    @ToString.Exclude
    private Beatmap beatmap;
    
    @JsonIgnore
    public boolean isLegacyScore() {
        return legacyScoreId != null;
    }
    
    /**
     * Number of judged objects which were not misses.
     */
    @JsonIgnore
    public int getTotalHits() {
        if (statistics == null) {
            return 0;
        }
        return statistics.entrySet().stream()
            .filter(e -> !MISS_RESULTS.contains(e.getKey()))
            .mapToInt(e -> e.getValue() == null ? 0 : e.getValue())
            .sum();
    }
}
