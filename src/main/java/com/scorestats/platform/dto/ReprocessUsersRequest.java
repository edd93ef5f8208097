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
public class ReprocessUsersRequest {
    @NotNull(message = "Ruleset cannot be null")
    @Min(value = 0, message = "Ruleset cannot be negative")
    private Integer rulesetId;
    
    @NotNull(message = "User IDs cannot be null")
    private List<Integer> userIds;
    
    @Min(value = 1, message = "Threads must be at least 1")
    @Max(value = 64, message = "Threads cannot exceed 64")
    private int threads = 1;
}
