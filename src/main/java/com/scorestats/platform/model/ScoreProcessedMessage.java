package com.scorestats.platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreProcessedMessage {
    @JsonProperty("ScoreId")
    private long scoreId;
    
    @JsonProperty("ProcessedVersion")
    private int processedVersion;
}
