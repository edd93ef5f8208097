package com.scorestats.platform.support;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.UserAchievement;
import com.scorestats.platform.repository.MedalRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class InMemoryMedalRepository implements MedalRepository {
    
    private final List<Medal> medals = new ArrayList<>();
    private final Map<Integer, List<Integer>> packs = new HashMap<>();
    private final List<UserAchievement> achievements = new ArrayList<>();
    
    public void addMedal(Medal medal) {
        medals.add(medal);
    }
    
    public void addPack(int packId, List<Integer> beatmapsetIds) {
        packs.put(packId, List.copyOf(beatmapsetIds));
    }
    
    public List<UserAchievement> getAchievements() {
        return achievements;
    }
    
    @Override
    public List<Medal> findAllOrdered() {
        return medals.stream()
            .sorted(Comparator.comparingInt(Medal::getOrdering).thenComparingInt(Medal::getAchievementId))
            .toList();
    }
    
    @Override
    public List<Integer> findPackBeatmapsetIds(int packId) {
        return packs.getOrDefault(packId, List.of());
    }
    
    @Override
    public Set<Integer> findAwardedMedalIds(int userId) {
        return achievements.stream()
            .filter(a -> a.getUserId() == userId)
            .map(UserAchievement::getAchievementId)
            .collect(Collectors.toSet());
    }
    
    @Override
    public UserAchievement saveAchievement(UserAchievement userAchievement) {
        boolean exists = achievements.stream()
            .anyMatch(a -> a.getUserId() == userAchievement.getUserId() && a.getAchievementId() == userAchievement.getAchievementId());
        if (exists) {
            throw new IllegalStateException("Duplicate achievement " + userAchievement);
        }
        achievements.add(userAchievement);
        return userAchievement;
    }
}
