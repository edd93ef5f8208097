package com.scorestats.platform.repository;

import com.scorestats.platform.model.UserStats;

import java.util.Optional;

public interface UserStatsRepository {
    Optional<UserStats> find(int userId, int rulesetId);
    UserStats save(UserStats userStats);
}
