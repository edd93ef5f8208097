package com.scorestats.platform.repository;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.UserAchievement;

import java.util.List;
import java.util.Set;

public interface MedalRepository {
    List<Medal> findAllOrdered();
    List<Integer> findPackBeatmapsetIds(int packId);
    Set<Integer> findAwardedMedalIds(int userId);
    UserAchievement saveAchievement(UserAchievement userAchievement);
}
