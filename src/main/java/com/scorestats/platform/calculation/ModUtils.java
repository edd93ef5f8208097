package com.scorestats.platform.calculation;

import com.scorestats.platform.model.Mod;
import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.model.Score;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Classification of mods and their conversion to the legacy bitmask used to key stored difficulty attributes.
 */
public final class ModUtils {

    public static final int NO_FAIL = 1;
    public static final int EASY = 1 << 1;
    public static final int TOUCH_DEVICE = 1 << 2;
    public static final int HIDDEN = 1 << 3;
    public static final int HARD_ROCK = 1 << 4;
    public static final int SUDDEN_DEATH = 1 << 5;
    public static final int DOUBLE_TIME = 1 << 6;
    public static final int RELAX = 1 << 7;
    public static final int HALF_TIME = 1 << 8;
    public static final int NIGHTCORE = 1 << 9;
    public static final int FLASHLIGHT = 1 << 10;
    public static final int AUTOPLAY = 1 << 11;
    public static final int SPUN_OUT = 1 << 12;
    public static final int AUTOPILOT = 1 << 13;
    public static final int PERFECT = 1 << 14;
    public static final int KEY4 = 1 << 15;
    public static final int KEY5 = 1 << 16;
    public static final int KEY6 = 1 << 17;
    public static final int KEY7 = 1 << 18;
    public static final int KEY8 = 1 << 19;
    public static final int FADE_IN = 1 << 20;
    public static final int RANDOM = 1 << 21;
    public static final int CINEMA = 1 << 22;
    public static final int TARGET = 1 << 23;
    public static final int KEY9 = 1 << 24;
    public static final int KEY_COOP = 1 << 25;
    public static final int KEY1 = 1 << 26;
    public static final int KEY3 = 1 << 27;
    public static final int KEY2 = 1 << 28;
    public static final int SCORE_V2 = 1 << 29;
    public static final int MIRROR = 1 << 30;

    public static final int KEY_MODS = KEY1 | KEY2 | KEY3 | KEY4 | KEY5 | KEY6 | KEY7 | KEY8 | KEY9 | KEY_COOP;

    private static final Map<String, Integer> LEGACY_VALUES = Map.ofEntries(
        Map.entry("NF", NO_FAIL),
        Map.entry("EZ", EASY),
        Map.entry("TD", TOUCH_DEVICE),
        Map.entry("HD", HIDDEN),
        Map.entry("HR", HARD_ROCK),
        Map.entry("SD", SUDDEN_DEATH),
        Map.entry("DT", DOUBLE_TIME),
        Map.entry("RX", RELAX),
        Map.entry("HT", HALF_TIME),
        Map.entry("NC", NIGHTCORE | DOUBLE_TIME),
        Map.entry("FL", FLASHLIGHT),
        Map.entry("AT", AUTOPLAY),
        Map.entry("SO", SPUN_OUT),
        Map.entry("AP", AUTOPILOT),
        Map.entry("PF", PERFECT | SUDDEN_DEATH),
        Map.entry("4K", KEY4),
        Map.entry("5K", KEY5),
        Map.entry("6K", KEY6),
        Map.entry("7K", KEY7),
        Map.entry("8K", KEY8),
        Map.entry("FI", FADE_IN),
        Map.entry("RD", RANDOM),
        Map.entry("CN", CINEMA | AUTOPLAY),
        Map.entry("TP", TARGET),
        Map.entry("9K", KEY9),
        Map.entry("DS", KEY_COOP),
        Map.entry("1K", KEY1),
        Map.entry("3K", KEY3),
        Map.entry("2K", KEY2),
        Map.entry("SV2", SCORE_V2),
        Map.entry("MR", MIRROR)
    );

    private static final Set<String> DIFFICULTY_REDUCTION = Set.of("EZ", "NF", "HT", "DC");

    private static final Set<String> AUTOMATION = Set.of("AT", "CN", "RX", "AP", "SO");

    private static final Set<String> PERFORMANCE_ALLOWED = Set.of(
        "EZ", "NF", "SD", "PF", "HR", "HD", "FL", "MU", "NC", "DT", "DC", "HT");

    private static final Set<String> OSU_PERFORMANCE_ALLOWED = Set.of("SO", "TD");

    private static final Set<String> MANIA_PERFORMANCE_ALLOWED = Set.of("4K", "5K", "6K", "7K", "8K", "9K", "MR");

    private ModUtils() {
    }

    /**
     * Legacy bitmask of the given mods. Mods without a legacy counterpart are ignored.
     */
    public static int toLegacyMods(Collection<Mod> mods) {
        int value = 0;
        for (Mod mod : mods) {
            value |= LEGACY_VALUES.getOrDefault(mod.getAcronym(), 0);
        }
        return value;
    }

    /**
     * Keeps only the bits which change stored difficulty attributes.
     */
    public static int maskRelevantMods(int mods, boolean isConvertedBeatmap, int rulesetId) {
        int relevantMods = DOUBLE_TIME | HALF_TIME | HARD_ROCK | EASY;

        if (rulesetId == Ruleset.OSU.getId()) {
            if ((mods & FLASHLIGHT) > 0) {
                relevantMods |= FLASHLIGHT | HIDDEN | TOUCH_DEVICE;
            } else {
                relevantMods |= FLASHLIGHT | TOUCH_DEVICE;
            }
        } else if (rulesetId == Ruleset.MANIA.getId() && isConvertedBeatmap) {
            relevantMods |= KEY_MODS;
        }

        return mods & relevantMods;
    }

    /**
     * Easy, no fail, half time and daycore. The same mods count as reductions in every ruleset.
     */
    public static boolean isDifficultyReduction(Mod mod) {
        return DIFFICULTY_REDUCTION.contains(mod.getAcronym());
    }

    public static boolean containsDifficultyReduction(Collection<Mod> mods) {
        return mods.stream().anyMatch(ModUtils::isDifficultyReduction);
    }

    public static boolean containsAutomation(Collection<Mod> mods) {
        return mods.stream().anyMatch(m -> AUTOMATION.contains(m.getAcronym()));
    }

    /**
     * Whether every mod of the score may contribute to performance.
     */
    public static boolean allModsValidForPerformance(Score score, Collection<Mod> mods) {
        for (Mod mod : mods) {
            if (!isValidForPerformance(score, mod.getAcronym())) {
                return false;
            }

            if (!mod.usesDefaultConfiguration()) {
                return false;
            }
        }

        return true;
    }

    private static boolean isValidForPerformance(Score score, String acronym) {
        boolean mania = score.getRulesetId() == Ruleset.MANIA.getId();

        if (mania && "HR".equals(acronym)) {
            return false;
        }

        if (PERFORMANCE_ALLOWED.contains(acronym)) {
            return true;
        }

        if ("CL".equals(acronym)) {
            return score.isLegacyScore();
        }

        if (score.getRulesetId() == Ruleset.OSU.getId()) {
            return OSU_PERFORMANCE_ALLOWED.contains(acronym);
        }

        return mania && MANIA_PERFORMANCE_ALLOWED.contains(acronym);
    }
}
