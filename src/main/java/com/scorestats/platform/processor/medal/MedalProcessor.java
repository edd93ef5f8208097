package com.scorestats.platform.processor.medal;

import com.scorestats.platform.model.Medal;
import com.scorestats.platform.model.MedalConditionType;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserAchievement;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.processor.ScoreProcessor;
import com.scorestats.platform.repository.BeatmapRepository;
import com.scorestats.platform.repository.MedalRepository;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Awards medals after every other processor has updated the user's statistics.
 * <p>
 * A medal is awarded at most once per user: the stored achievement is the only record of an award, and it is
 * never reverted. Achievements are written with the rest of the score's statistics; listeners only hear about
 * them from {@link #applyGlobal}, once that write has committed.
 */
@Component
public class MedalProcessor implements ScoreProcessor {
    
    public static final int ORDER = 100;
    
    private static final Logger logger = LoggerFactory.getLogger(MedalProcessor.class);
    
    private final MedalRepository medalRepository;
    private final MedalAwardNotifier notifier;
    private final Clock clock;
    private final Map<MedalConditionType, MedalAwarder> awarders = new EnumMap<>(MedalConditionType.class);
    
    // Awards written by the open transaction of each score, keyed by score id.
    private final ConcurrentMap<Long, List<AwardedMedal>> pendingAwards = new ConcurrentHashMap<>();
    
    @Autowired
    public MedalProcessor(
            MedalRepository medalRepository,
            BeatmapRepository beatmapRepository,
            ScoreRepository scoreRepository,
            BeatmapStore beatmapStore,
            MedalAwardNotifier notifier,
            Clock clock) {
        this(medalRepository, notifier, clock, List.of(
            new PackMedalAwarder(medalRepository, beatmapRepository, scoreRepository, beatmapStore),
            new PlayCountMedalAwarder(),
            new ComboMedalAwarder(beatmapStore)
        ));
    }
    
    public MedalProcessor(
            MedalRepository medalRepository,
            MedalAwardNotifier notifier,
            Clock clock,
            List<MedalAwarder> awarders) {
        this.medalRepository = medalRepository;
        this.notifier = notifier;
        this.clock = clock;
        
        for (MedalAwarder awarder : awarders) {
            this.awarders.put(awarder.getConditionType(), awarder);
        }
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
        return false;
    }
    
    @Override
    public void applyToUserStats(Score score, UserStats userStats) {
        // A redelivered score starts over; whatever an earlier attempt recorded was rolled back with it.
        pendingAwards.remove(score.getId());
        
        if (!score.isPassed()) {
            return;
        }
        
        List<AwardedMedal> awards = new ArrayList<>();
        Set<Integer> awarded = new HashSet<>(medalRepository.findAwardedMedalIds(score.getUserId()));
        
        for (Medal medal : medalRepository.findAllOrdered()) {
            if (awarded.contains(medal.getAchievementId()) || !medal.appliesToRuleset(score.getRulesetId())) {
                continue;
            }
            
            MedalAwarder awarder = awarders.get(medal.getConditionType());
            
            if (awarder == null) {
                logger.debug("No awarder for medal {} of type {}", medal.getAchievementId(), medal.getConditionType());
                continue;
            }
            
            if (awarder.isAwardable(medal, score, userStats)) {
                awards.add(award(medal, score));
                awarded.add(medal.getAchievementId());
            }
        }
        
        if (!awards.isEmpty()) {
            pendingAwards.put(score.getId(), awards);
        }
    }
    
    /**
     * Awards are permanent.
     */
    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
    }
    
    /**
     * Notifies listeners of the awards the score's committed transaction wrote.
     */
    @Override
    public void applyGlobal(Score score) {
        List<AwardedMedal> awards = pendingAwards.remove(score.getId());
        
        if (awards == null) {
            return;
        }
        
        for (AwardedMedal awardedMedal : awards) {
            notifier.notifyAwarded(awardedMedal);
        }
    }
    
    @Override
    public void onRollback(Score score) {
        List<AwardedMedal> discarded = pendingAwards.remove(score.getId());
        
        if (discarded != null) {
            logger.info("Discarded {} medal awards for score {} after rollback", discarded.size(), score.getId());
        }
    }
    
    private AwardedMedal award(Medal medal, Score score) {
        medalRepository.saveAchievement(UserAchievement.builder()
            .userId(score.getUserId())
            .achievementId(medal.getAchievementId())
            .beatmapId(score.getBeatmapId())
            .date(Instant.now(clock))
            .build());
        
        logger.info("Awarded medal {} ({}) to user {} for score {}",
            medal.getAchievementId(), medal.getSlug(), score.getUserId(), score.getId());
        
        return new AwardedMedal(medal, score);
    }
}
