package com.scorestats.platform.support;

import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.UserStatsRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores copies, so changes made to a loaded row only show up once saved.
 */
public class InMemoryUserStatsRepository implements UserStatsRepository {
    
    private final Map<String, UserStats> rows = new ConcurrentHashMap<>();
    
    @Override
    public Optional<UserStats> find(int userId, int rulesetId) {
        return Optional.ofNullable(rows.get(key(userId, rulesetId))).map(UserStats::copy);
    }
    
    @Override
    public UserStats save(UserStats userStats) {
        rows.put(key(userStats.getUserId(), userStats.getRulesetId()), userStats.copy());
        return userStats;
    }
    
    public UserStats get(int userId, int rulesetId) {
        return find(userId, rulesetId).orElseThrow();
    }
    
    private static String key(int userId, int rulesetId) {
        return userId + ":" + rulesetId;
    }
}
