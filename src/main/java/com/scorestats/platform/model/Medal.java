package com.scorestats.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An achievement definition.
 */
@Entity
@Table(name = "osu_achievements")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Medal {
    @Id
    @Column(name = "achievement_id")
    private int achievementId;
    
    @Column(name = "slug", nullable = false)
    private String slug;
    
    @Column(name = "name", nullable = false)
    private String name;
    
    @Column(name = "ordering", nullable = false)
    private int ordering;
    
    @Column(name = "grouping")
    private String grouping;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "condition_type", nullable = false)
    private MedalConditionType conditionType;
    
    @Column(name = "pack_id")
    private Integer packId;
    
    @Column(name = "no_reduction_mods", nullable = false)
    private boolean noReductionMods;
    
    @Column(name = "threshold")
    private Long threshold;
    
    /**
     * Restricts the medal to scores of one ruleset, or any ruleset when null.
     */
    @Column(name = "mode")
    private Integer rulesetId;
    
    public boolean appliesToRuleset(int scoreRulesetId) {
        return rulesetId == null || rulesetId == scoreRulesetId;
    }
}
