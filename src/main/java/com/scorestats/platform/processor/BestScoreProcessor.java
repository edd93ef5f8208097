package com.scorestats.platform.processor;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;

import java.util.Comparator;
import java.util.Optional;

/**
 * Base for statistics derived from the user's best ranked score on each beatmap.
 * <p>
 * Applying a score that beats the previous best swaps the previous best's contribution for its own; reverting
 * swaps it back. Scores which do not beat the previous best contribute nothing. Only scores which have been
 * processed can be the previous best, since only their contribution is part of the statistics.
 */
public abstract class BestScoreProcessor implements ScoreProcessor {
    
    private static final Comparator<Score> BEST_FIRST = Comparator.comparingLong(Score::getTotalScore).reversed()
        .thenComparing(Score::getId);
    
    private final ScoreRepository scoreRepository;
    private final BeatmapStore beatmapStore;
    
    protected BestScoreProcessor(ScoreRepository scoreRepository, BeatmapStore beatmapStore) {
        this.scoreRepository = scoreRepository;
        this.beatmapStore = beatmapStore;
    }
    
    /**
     * Adds ({@code sign} = 1) or removes ({@code sign} = -1) the contribution of {@code score}.
     */
    protected abstract void contribute(Score score, UserStats userStats, int sign);
    
    @Override
    public boolean runOnFailedScores() {
        return false;
    }
    
    @Override
    public boolean runOnLegacyScores() {
        return false;
    }
    
    @Override
    public void applyToUserStats(Score score, UserStats userStats) {
        if (!counts(score)) {
            return;
        }
        
        Optional<Score> previousBest = findBestExcluding(score);
        
        if (previousBest.isEmpty()) {
            contribute(score, userStats, 1);
        } else if (beats(score, previousBest.get())) {
            contribute(previousBest.get(), userStats, -1);
            contribute(score, userStats, 1);
        }
    }
    
    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
        if (!counts(score)) {
            return;
        }
        
        Optional<Score> previousBest = findBestExcluding(score);
        
        if (previousBest.isEmpty()) {
            contribute(score, userStats, -1);
        } else if (beats(score, previousBest.get())) {
            contribute(score, userStats, -1);
            contribute(previousBest.get(), userStats, 1);
        }
    }
    
    @Override
    public void applyGlobal(Score score) {
    }
    
    private boolean counts(Score score) {
        if (!score.isPassed() || !score.isRanked()) {
            return false;
        }
        return beatmapStore.getBeatmap(score.getBeatmapId())
            .map(Beatmap::isRankedOrApproved)
            .orElse(false);
    }
    
    private Optional<Score> findBestExcluding(Score score) {
        return scoreRepository.findProcessedRankedPassedScores(score.getUserId(), score.getBeatmapId(), score.getRulesetId()).stream()
            .filter(s -> !s.getId().equals(score.getId()))
            .filter(s -> !s.isLegacyScore())
            .min(BEST_FIRST);
    }
    
    private static boolean beats(Score score, Score other) {
        return BEST_FIRST.compare(score, other) < 0;
    }
}
