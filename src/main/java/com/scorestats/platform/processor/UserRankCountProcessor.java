package com.scorestats.platform.processor;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Counts of grades (SS, S and A, with their silver variants) over the user's best score on each ranked beatmap.
 */
@Component
public class UserRankCountProcessor extends BestScoreProcessor {
    
    @Autowired
    public UserRankCountProcessor(ScoreRepository scoreRepository, BeatmapStore beatmapStore) {
        super(scoreRepository, beatmapStore);
    }
    
    @Override
    protected void contribute(Score score, UserStats userStats, int sign) {
        userStats.adjustRankCount(score.getRank(), sign);
    }
}
