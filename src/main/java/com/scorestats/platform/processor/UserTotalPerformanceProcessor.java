package com.scorestats.platform.processor;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.ScoreRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes a user's total performance and weighted accuracy from their best score on each beatmap.
 * The result only depends on stored scores, so reverting is not required.
 */
@Component
public class UserTotalPerformanceProcessor implements ScoreProcessor {

    public static final int ORDER = ScorePerformanceProcessor.ORDER + 1;

    private static final int MAX_SCORES = 1000;
    private static final double WEIGHT = 0.95;

    private final ScoreRepository scoreRepository;

    @Autowired
    public UserTotalPerformanceProcessor(ScoreRepository scoreRepository) {
        this.scoreRepository = scoreRepository;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    public boolean runOnFailedScores() {
        return false;
    }

    @Override
    public boolean runOnLegacyScores() {
        return true;
    }

    @Override
    public void applyToUserStats(Score score, UserStats userStats) {
        updateUserStats(userStats, score);
    }

    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
    }

    @Override
    public void applyGlobal(Score score) {
    }

    /**
     * Recomputes totals from stored scores only.
     */
    public void updateUserStats(UserStats userStats) {
        updateUserStats(userStats, null);
    }

    private void updateUserStats(UserStats userStats, Score current) {
        List<Score> scores = new ArrayList<>(scoreRepository.findRankedPassedScores(userStats.getUserId(), userStats.getRulesetId()));

        // The stored copy of the score being processed may predate its performance update.
        if (current != null) {
            scores.removeIf(s -> s.getId().equals(current.getId()));
            if (current.isPassed() && current.isRanked()) {
                scores.add(current);
            }
        }

        Map<Integer, Score> bestPerBeatmap = new HashMap<>();
        for (Score score : scores) {
            if (score.getPp() == null) {
                continue;
            }
            bestPerBeatmap.merge(score.getBeatmapId(), score, (a, b) -> b.getPp() > a.getPp() ? b : a);
        }

        List<Score> best = bestPerBeatmap.values().stream()
            .sorted(Comparator.comparingDouble(Score::getPp).reversed().thenComparing(Score::getId))
            .limit(MAX_SCORES)
            .toList();

        double totalPp = 0;
        double totalAccuracy = 0;
        double factor = 1;

        for (Score score : best) {
            totalPp += score.getPp() * factor;
            totalAccuracy += score.getAccuracy() * factor;
            factor *= WEIGHT;
        }

        // Keeps compatibility with the diminishing bonus of 0.25 by 0.9994 each score of the previous system.
        totalPp += (417.0 - 1.0 / 3.0) * (1.0 - Math.pow(0.995, Math.min(best.size(), MAX_SCORES)));

        // Normalised to a percentage.
        if (!best.isEmpty()) {
            totalAccuracy *= 100.0 / (20 * (1 - Math.pow(WEIGHT, best.size())));
        }

        userStats.setPerformance(totalPp);
        userStats.setAccuracy(totalAccuracy);
    }
}
