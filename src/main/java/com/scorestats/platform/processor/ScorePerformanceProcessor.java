package com.scorestats.platform.processor;

import com.scorestats.platform.calculation.DifficultyAttributes;
import com.scorestats.platform.calculation.ModUtils;
import com.scorestats.platform.calculation.PerformanceCalculator;
import com.scorestats.platform.calculation.PerformanceCalculatorRegistry;
import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.model.Score;
import com.scorestats.platform.model.UserStats;
import com.scorestats.platform.repository.LegacyScoreRepository;
import com.scorestats.platform.repository.ScoreRepository;
import com.scorestats.platform.store.BeatmapStore;
import com.scorestats.platform.store.BuildStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Computes the performance points of scores.
 * <p>
 * A score which cannot award performance is flagged non-ranked instead; the rest of the pipeline still runs for it.
 */
@Component
public class ScorePerformanceProcessor implements ScoreProcessor {

    public static final int ORDER = 0;

    private static final Logger logger = LoggerFactory.getLogger(ScorePerformanceProcessor.class);

    private final BeatmapStore beatmapStore;
    private final BuildStore buildStore;
    private final PerformanceCalculatorRegistry calculators;
    private final ScoreRepository scoreRepository;
    private final LegacyScoreRepository legacyScoreRepository;

    @Autowired
    public ScorePerformanceProcessor(
            BeatmapStore beatmapStore,
            BuildStore buildStore,
            PerformanceCalculatorRegistry calculators,
            ScoreRepository scoreRepository,
            LegacyScoreRepository legacyScoreRepository) {
        this.beatmapStore = beatmapStore;
        this.buildStore = buildStore;
        this.calculators = calculators;
        this.scoreRepository = scoreRepository;
        this.legacyScoreRepository = legacyScoreRepository;
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
        processScore(score);
    }

    @Override
    public void revertFromUserStats(Score score, UserStats userStats, int previousVersion) {
    }

    /**
     * Mirrors the computed value into the legacy high score table, which is still polled by older consumers.
     */
    @Override
    public void applyGlobal(Score score) {
        if (!score.isLegacyScore() || !score.isPassed() || score.getPp() == null) {
            return;
        }

        Ruleset.fromId(score.getRulesetId()).ifPresent(ruleset ->
            legacyScoreRepository.updatePerformance(ruleset, score.getLegacyScoreId(), score.getPp()));
    }

    /**
     * Processes the performance value of every score a user has set in a ruleset.
     *
     * @return the scores which were processed
     */
    public List<Score> processUserScores(int userId, int rulesetId) {
        List<Score> scores = scoreRepository.findByUserIdAndRulesetId(userId, rulesetId);

        for (Score score : scores) {
            processScore(score);
        }

        return scores;
    }

    /**
     * Processes the performance value of a stored score.
     *
     * @return false if the score does not exist
     */
    public boolean processScore(long scoreId) {
        Optional<Score> score = scoreRepository.findById(scoreId);

        if (score.isEmpty()) {
            logger.warn("Could not find score ID {}", scoreId);
            return false;
        }

        processScore(score.get());
        return true;
    }

    /**
     * Processes the performance value of a score, writing either its value or the non-ranked flag.
     */
    public void processScore(Score score) {
        // Usually checked through runOnFailedScores, but batch reprocessing calls this directly.
        if (!score.isPassed()) {
            return;
        }

        Optional<Beatmap> beatmap = beatmapStore.getBeatmap(score.getBeatmapId());

        if (beatmap.isEmpty() || !beatmapStore.isBeatmapValidForPerformance(beatmap.get(), score.getRulesetId())) {
            markNonRanked(score);
            return;
        }

        Optional<Ruleset> ruleset = Ruleset.fromId(score.getRulesetId());

        if (ruleset.isEmpty() || !ModUtils.allModsValidForPerformance(score, score.getMods())) {
            markNonRanked(score);
            return;
        }

        Optional<DifficultyAttributes> attributes = beatmapStore.getDifficultyAttributes(beatmap.get(), ruleset.get(), score.getMods());

        // Legacy scores don't carry a build.
        if (!score.isLegacyScore() && !buildStore.allowsPerformance(score.getBuildId())) {
            markNonRanked(score);
            return;
        }

        if (attributes.isEmpty()) {
            markNonRanked(score);
            return;
        }

        OptionalDouble pp = calculate(score, ruleset.get(), attributes.get());

        if (pp.isEmpty()) {
            markNonRanked(score);
            return;
        }

        score.setPp(pp.getAsDouble());
        scoreRepository.updatePerformance(score.getId(), pp.getAsDouble());
    }

    private OptionalDouble calculate(Score score, Ruleset ruleset, DifficultyAttributes attributes) {
        Optional<PerformanceCalculator> calculator = calculators.forRuleset(ruleset);

        if (calculator.isEmpty()) {
            return OptionalDouble.empty();
        }

        try {
            return calculator.get().computePerformance(score, attributes);
        } catch (RuntimeException e) {
            logger.error("Performance calculation failed for score {}", score.getId(), e);
            return OptionalDouble.empty();
        }
    }

    private void markNonRanked(Score score) {
        score.setRanked(false);
        scoreRepository.markNonRanked(score.getId());
    }
}
