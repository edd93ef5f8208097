package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Queue envelope: a score plus the history of its previous processing, if any.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreItem {
    private Score score;
    private ProcessHistory processHistory;
    
    @Builder.Default
    private Integer retryCount = 0;
    
    @JsonIgnore
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    
    /**
     * A history entry recording {@code version}, leaving the current one untouched until the change commits.
     */
    public ProcessHistory toProcessedHistory(int version, Instant processedAt) {
        return ProcessHistory.builder()
            .scoreId(score.getId())
            .processedVersion(version)
            .processedAt(processedAt)
            .build();
    }
}
