package com.scorestats.platform.model;

/**
 * Approval state of a beatmap, stored by its numeric value.
 */
public enum BeatmapOnlineStatus {
    GRAVEYARD(-2),
    WIP(-1),
    PENDING(0),
    RANKED(1),
    APPROVED(2),
    QUALIFIED(3),
    LOVED(4);
    
    private final int value;
    
    BeatmapOnlineStatus(int value) {
        this.value = value;
    }
    
    public int getValue() {
        return value;
    }
    
    public static BeatmapOnlineStatus fromValue(int value) {
        for (BeatmapOnlineStatus status : values()) {
            if (status.value == value) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown beatmap status: " + value);
    }
}
