package com.scorestats.platform.model;

import java.util.Optional;

/**
 * The rulesets scores can be submitted for, keyed by their online id.
 */
public enum Ruleset {
    OSU(0, "osu_scores_high"),
    TAIKO(1, "osu_scores_taiko_high"),
    CATCH(2, "osu_scores_fruits_high"),
    MANIA(3, "osu_scores_mania_high");
    
    private final int id;
    private final String legacyHighScoreTable;
    
    Ruleset(int id, String legacyHighScoreTable) {
        this.id = id;
        this.legacyHighScoreTable = legacyHighScoreTable;
    }
    
    public int getId() {
        return id;
    }
    
    public String getLegacyHighScoreTable() {
        return legacyHighScoreTable;
    }
    
    public static Optional<Ruleset> fromId(int id) {
        for (Ruleset ruleset : values()) {
            if (ruleset.id == id) {
                return Optional.of(ruleset);
            }
        }
        return Optional.empty();
    }
    
    public static boolean isSupported(int id) {
        return fromId(id).isPresent();
    }
}
