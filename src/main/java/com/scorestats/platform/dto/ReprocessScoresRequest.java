package com.scorestats.platform.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReprocessScoresRequest {
    @NotNull(message = "Score IDs cannot be null")
    private List<Long> scoreIds;
    
    @Min(value = 1, message = "Threads must be at least 1")
    @Max(value = 64, message = "Threads cannot exceed 64")
    private int threads = 1;
}
