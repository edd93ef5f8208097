package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.UserAchievement;
import com.scorestats.platform.model.UserAchievementId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserAchievementJpaRepository extends JpaRepository<UserAchievement, UserAchievementId> {
    List<UserAchievement> findByUserId(int userId);
}
