package com.scorestats.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessScoreResponse {
    private long scoreId;
    private Integer processedVersion;
    private List<String> tags;
}
