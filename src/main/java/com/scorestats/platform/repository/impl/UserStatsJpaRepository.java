package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.model.UserStatsId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserStatsJpaRepository extends JpaRepository<UserStats, UserStatsId> {
}
