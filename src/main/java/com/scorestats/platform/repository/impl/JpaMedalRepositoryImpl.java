package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.BeatmapPackItem;
import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.UserAchievement;
import com.scorestats.platform.repository.MedalRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class JpaMedalRepositoryImpl implements MedalRepository {
    
    private final MedalJpaRepository medalRepository;
    private final BeatmapPackItemJpaRepository packItemRepository;
    private final UserAchievementJpaRepository achievementRepository;
    
    @Autowired
    public JpaMedalRepositoryImpl(
            MedalJpaRepository medalRepository,
            BeatmapPackItemJpaRepository packItemRepository,
            UserAchievementJpaRepository achievementRepository) {
        this.medalRepository = medalRepository;
        this.packItemRepository = packItemRepository;
        this.achievementRepository = achievementRepository;
    }
    
    @Override
    public List<Medal> findAllOrdered() {
        return medalRepository.findAllByOrderByOrderingAscAchievementIdAsc();
    }
    
    @Override
    public List<Integer> findPackBeatmapsetIds(int packId) {
        return packItemRepository.findByPackId(packId).stream()
            .map(BeatmapPackItem::getBeatmapsetId)
            .toList();
    }
    
    @Override
    public Set<Integer> findAwardedMedalIds(int userId) {
        return achievementRepository.findByUserId(userId).stream()
            .map(UserAchievement::getAchievementId)
            .collect(Collectors.toSet());
    }
    
    @Override
    public UserAchievement saveAchievement(UserAchievement userAchievement) {
        return achievementRepository.save(userAchievement);
    }
}
