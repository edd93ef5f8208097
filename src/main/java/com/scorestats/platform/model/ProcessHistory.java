package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Records which pipeline version last folded a score into its user's statistics.
 */
@Entity
@Table(name = "score_process_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessHistory {
    @Id
    @Column(name = "score_id")
    private Long scoreId;
    
    @Column(name = "processed_version", nullable = false)
    private int processedVersion;
    
    @Column(name = "processed_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant processedAt;
}
