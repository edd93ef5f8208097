package com.scorestats.platform.processor.medal;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.Score;
import lombok.Value;

/**
 * A medal which was just awarded, and the score which triggered it.
 */
@Value
public class AwardedMedal {
    Medal medal;
    Score score;
    
    public int getUserId() {
        return score.getUserId();
    }
    
    public int getMedalId() {
        return medal.getAchievementId();
    }
}
