package com.scorestats.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.scorestats.platform.service.BatchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResponse {
    private int processed;
    private int total;
    private boolean cancelled;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completedAt;
    
    public static BatchResponse from(BatchResult result) {
        return BatchResponse.builder()
            .processed(result.getProcessed())
            .total(result.getTotal())
            .cancelled(result.isCancelled())
            .completedAt(Instant.now())
            .build();
    }
}
