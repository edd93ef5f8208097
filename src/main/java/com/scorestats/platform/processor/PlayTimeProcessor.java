package com.scorestats.platform.processor;

import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.store.BeatmapStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Adds the time spent in a play, bounded by the rate-adjusted length of the beatmap.
 */
@Component
public class PlayTimeProcessor implements ScoreProcessor {
    
    private final BeatmapStore beatmapStore;
    
    @Autowired
    public PlayTimeProcessor(BeatmapStore beatmapStore) {
        this.beatmapStore = beatmapStore;
    }
    
    @Override
    public boolean runOnFailedScores() {
        return true;
    }
    
    @Override
    public boolean runOnLegacyScores() {
        return false;
    }
    
    @Override
    public void applyToUserStats(Score score, UserStats userStats) {
        if (!PlayCountProcessor.isValidPlay(score)) {
            return;
        }
        userStats.setPlayTime(userStats.getPlayTime() + getPlayLength(score));
    }
    
    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
        if (previousVersion < PlayCountProcessor.VALID_PLAYS_ONLY_VERSION || PlayCountProcessor.isValidPlay(score)) {
            userStats.setPlayTime(userStats.getPlayTime() - getPlayLength(score));
        }
    }
    
    @Override
    public void applyGlobal(Score score) {
    }
    
    long getPlayLength(Score score) {
        if (score.getStartedAt() == null || score.getEndedAt() == null) {
            return 0;
        }
        
        long seconds = Math.max(0, Duration.between(score.getStartedAt(), score.getEndedAt()).getSeconds());
        
        Optional<Beatmap> beatmap = beatmapStore.getBeatmap(score.getBeatmapId());
        if (beatmap.isEmpty()) {
            return seconds;
        }
        
        long maxLength = (long) Math.ceil(beatmap.get().getTotalLength() / getRate(score));
        return Math.min(seconds, maxLength);
    }
    
    private static double getRate(Score score) {
        double rate = 1;
        for (Mod mod : score.getMods()) {
            switch (mod.getAcronym()) {
                case "DT", "NC" -> rate *= 1.5;
                case "HT", "DC" -> rate *= 0.75;
                default -> {
                }
            }
        }
        return rate;
    }
}
