package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.model.UserStatsId;
import com.scorestats.platform.repository.UserStatsRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JpaUserStatsRepositoryImpl implements UserStatsRepository {
    
    private final UserStatsJpaRepository jpaRepository;
    
    @Autowired
    public JpaUserStatsRepositoryImpl(UserStatsJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Optional<UserStats> find(int userId, int rulesetId) {
        return jpaRepository.findById(new UserStatsId(userId, rulesetId));
    }
    
    @Override
    public UserStats save(UserStats userStats) {
        return jpaRepository.save(userStats);
    }
}
