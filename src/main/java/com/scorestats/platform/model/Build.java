package com.scorestats.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A client build scores may be submitted from.
 */
@Entity
@Table(name = "osu_builds")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Build {
    @Id
    @Column(name = "build_id")
    private int buildId;
    
    @Column(name = "version")
    private String version;
    
    @Column(name = "allow_performance", nullable = false)
    private boolean allowPerformance;
}
