package com.scorestats.platform.store;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Getter
@Component
public class StoreSettings {
    
    private final long refreshIntervalMs;
    private final boolean realtimeDifficulty;
    
    public StoreSettings(
            @Value("${score-statistics.store.refresh-interval-ms:60000}") long refreshIntervalMs,
            @Value("${score-statistics.difficulty.realtime:false}") boolean realtimeDifficulty) {
        this.refreshIntervalMs = refreshIntervalMs;
        this.realtimeDifficulty = realtimeDifficulty;
    }
}
