package com.scorestats.platform.processor.medal;

import com.scorestats.platform.calculation.ModUtils;
import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.MedalConditionType;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.BeatmapRepository;
import com.scorestats.platform.repository.MedalRepository;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Awards pack medals once every beatmapset of the pack has at least one qualifying pass.
 * <p>
 * Completion is recomputed from the user's full pass history each time, so sets may be completed in any order
 * and a disqualified play may later be replaced by a qualifying one. Several difficulties of one set count once.
 */
public class PackMedalAwarder implements MedalAwarder {
    
    private final MedalRepository medalRepository;
    private final BeatmapRepository beatmapRepository;
    private final ScoreRepository scoreRepository;
    private final BeatmapStore beatmapStore;
    
    public PackMedalAwarder(
            MedalRepository medalRepository,
            BeatmapRepository beatmapRepository,
            ScoreRepository scoreRepository,
            BeatmapStore beatmapStore) {
        this.medalRepository = medalRepository;
        this.beatmapRepository = beatmapRepository;
        this.scoreRepository = scoreRepository;
        this.beatmapStore = beatmapStore;
    }
    
    @Override
    public MedalConditionType getConditionType() {
        return MedalConditionType.PACK;
    }
    
    @Override
    public boolean isAwardable(Medal medal, Score score, UserStats userStats) {
        if (medal.getPackId() == null) {
            return false;
        }
        
        Set<Integer> requiredSets = new HashSet<>(medalRepository.findPackBeatmapsetIds(medal.getPackId()));
        
        if (requiredSets.isEmpty()) {
            return false;
        }
        
        // Only a score inside the pack can change its completion.
        Optional<Beatmap> current = beatmapStore.getBeatmap(score.getBeatmapId());
        if (current.isEmpty() || !requiredSets.contains(current.get().getBeatmapsetId())) {
            return false;
        }
        
        Map<Integer, Integer> beatmapsetByBeatmap = new HashMap<>();
        for (Beatmap beatmap : beatmapRepository.findByBeatmapsetIds(requiredSets)) {
            beatmapsetByBeatmap.put(beatmap.getBeatmapId(), beatmap.getBeatmapsetId());
        }
        
        List<Score> candidates = new ArrayList<>(
            scoreRepository.findPassedByUserIdAndBeatmapIds(score.getUserId(), beatmapsetByBeatmap.keySet()));
        
        candidates.removeIf(s -> s.getId().equals(score.getId()));
        candidates.add(score);
        
        Set<Integer> completedSets = new HashSet<>();
        
        for (Score candidate : candidates) {
            if (!isQualifying(medal, candidate)) {
                continue;
            }
            
            Integer beatmapsetId = beatmapsetByBeatmap.get(candidate.getBeatmapId());
            if (beatmapsetId != null) {
                completedSets.add(beatmapsetId);
            }
        }
        
        return completedSets.containsAll(requiredSets);
    }
    
    private boolean isQualifying(Medal medal, Score score) {
        if (!score.isPassed() || !medal.appliesToRuleset(score.getRulesetId())) {
            return false;
        }
        
        return !medal.isNoReductionMods() || !ModUtils.containsDifficultyReduction(score.getMods());
    }
}
