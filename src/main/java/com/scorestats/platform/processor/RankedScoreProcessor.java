package com.scorestats.platform.processor;

import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Ranked score: the sum of the user's best total score on each ranked beatmap.
 */
@Component
public class RankedScoreProcessor extends BestScoreProcessor {
    
    @Autowired
    public RankedScoreProcessor(ScoreRepository scoreRepository, BeatmapStore beatmapStore) {
        super(scoreRepository, beatmapStore);
    }
    
    @Override
    protected void contribute(Score score, UserStats userStats, int sign) {
        userStats.setRankedScore(userStats.getRankedScore() + sign * score.getTotalScore());
    }
}
