package com.scorestats.platform.exception;

public class ScoreNotFoundException extends ScoreStatisticsException {
    public ScoreNotFoundException(String message) {
        super(message, "SCORE_NOT_FOUND");
    }
}
