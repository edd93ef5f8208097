package com.scorestats.platform.store;

import com.scorestats.platform.calculation.DifficultyAttributes;
import com.scorestats.platform.calculation.DifficultyCalculator;
import com.scorestats.platform.calculation.ModUtils;
import com.scorestats.platform.model.Beatmap;
import com.scorestats.platform.model.BeatmapDifficultyAttribute;
import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.repository.BeatmapRepository;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Process-local cache of beatmaps, difficulty attributes and the performance blacklist.
 * <p>
 * Lookups are memoized per key, including misses, for the lifetime of a snapshot. The whole snapshot is
 * rebuilt once it is older than the configured refresh interval.
 */
@Component
public class BeatmapStore {

    private static final Logger logger = LoggerFactory.getLogger(BeatmapStore.class);

    private final BeatmapRepository beatmapRepository;
    private final DifficultyCalculator difficultyCalculator;
    private final StoreSettings settings;
    private final Clock clock;

    private volatile Snapshot snapshot;

    @Autowired
    public BeatmapStore(
            BeatmapRepository beatmapRepository,
            ObjectProvider<DifficultyCalculator> difficultyCalculator,
            StoreSettings settings,
            Clock clock) {
        this.beatmapRepository = beatmapRepository;
        this.difficultyCalculator = difficultyCalculator.getIfAvailable();
        this.settings = settings;
        this.clock = clock;

        if (settings.isRealtimeDifficulty() && this.difficultyCalculator == null) {
            logger.warn("Realtime difficulty calculation requested but no calculator is available, using stored attributes");
        }
    }

    /**
     * Retrieves a beatmap, or empty if it does not exist.
     */
    public Optional<Beatmap> getBeatmap(int beatmapId) {
        return currentSnapshot().beatmaps.computeIfAbsent(beatmapId, beatmapRepository::findById);
    }

    /**
     * Retrieves the difficulty attributes of a beatmap under the given mods, or empty if none are available.
     */
    public Optional<DifficultyAttributes> getDifficultyAttributes(Beatmap beatmap, Ruleset ruleset, List<Mod> mods) {
        boolean converted = beatmap.getPlaymode() != ruleset.getId();
        int modValue = ModUtils.maskRelevantMods(ModUtils.toLegacyMods(mods), converted, ruleset.getId());
        DifficultyAttributeKey key = new DifficultyAttributeKey(beatmap.getBeatmapId(), ruleset.getId(), modValue);

        return currentSnapshot().attributes.computeIfAbsent(key, k -> loadDifficultyAttributes(k, beatmap, ruleset, mods));
    }

    /**
     * Whether performance points may be awarded for the given beatmap and ruleset combination.
     */
    public boolean isBeatmapValidForPerformance(Beatmap beatmap, int rulesetId) {
        if (currentSnapshot().blacklist.contains(new BlacklistEntry(beatmap.getBeatmapId(), rulesetId))) {
            return false;
        }

        return beatmap.isRankedOrApproved();
    }

    private Optional<DifficultyAttributes> loadDifficultyAttributes(DifficultyAttributeKey key, Beatmap beatmap, Ruleset ruleset, List<Mod> mods) {
        if (settings.isRealtimeDifficulty() && difficultyCalculator != null) {
            return difficultyCalculator.computeDifficulty(beatmap, ruleset, mods);
        }

        List<BeatmapDifficultyAttribute> rows = beatmapRepository.findDifficultyAttributes(key.getBeatmapId(), key.getRulesetId(), key.getModValue());

        if (rows.isEmpty()) {
            return Optional.empty();
        }

        Map<Integer, Double> values = rows.stream()
            .collect(Collectors.toMap(BeatmapDifficultyAttribute::getAttribId, BeatmapDifficultyAttribute::getValue, (a, b) -> b));

        return Optional.of(new DifficultyAttributes(key.getRulesetId(), values));
    }

    private Snapshot currentSnapshot() {
        Snapshot current = snapshot;
        long now = clock.millis();

        if (current != null && now - current.createdAt <= settings.getRefreshIntervalMs()) {
            return current;
        }

        synchronized (this) {
            if (snapshot == null || now - snapshot.createdAt > settings.getRefreshIntervalMs()) {
                snapshot = createSnapshot(now);
            }
            return snapshot;
        }
    }

    private Snapshot createSnapshot(long now) {
        Set<BlacklistEntry> blacklist = beatmapRepository.findPerformanceBlacklist().stream()
            .map(b -> new BlacklistEntry(b.getBeatmapId(), b.getMode()))
            .collect(Collectors.toUnmodifiableSet());

        logger.debug("Rebuilt beatmap store with {} blacklist entries", blacklist.size());
        return new Snapshot(now, blacklist);
    }

    private static final class Snapshot {
        private final long createdAt;
        private final Set<BlacklistEntry> blacklist;
        private final ConcurrentMap<Integer, Optional<Beatmap>> beatmaps = new ConcurrentHashMap<>();
        private final ConcurrentMap<DifficultyAttributeKey, Optional<DifficultyAttributes>> attributes = new ConcurrentHashMap<>();

        private Snapshot(long createdAt, Set<BlacklistEntry> blacklist) {
            this.createdAt = createdAt;
            this.blacklist = blacklist;
        }
    }

    @Value
    static class DifficultyAttributeKey {
        int beatmapId;
        int rulesetId;
        int modValue;
    }

    @Value
    static class BlacklistEntry {
        int beatmapId;
        int rulesetId;
    }
}
