package com.scorestats.platform.exception;

public class InvalidRequestException extends ScoreStatisticsException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
