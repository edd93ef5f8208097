package com.scorestats.platform.model;

public enum MedalConditionType {
    /**
     * Pass at least one beatmap of every set in a beatmap pack.
     */
    PACK,
    /**
     * Reach a play count in the medal's ruleset.
     */
    PLAY_COUNT,
    /**
     * Pass a ranked beatmap with at least the given combo.
     */
    COMBO
}
