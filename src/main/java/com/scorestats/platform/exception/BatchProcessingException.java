package com.scorestats.platform.exception;

public class BatchProcessingException extends ScoreStatisticsException {
    public BatchProcessingException(String message, Throwable cause) {
        super(message, "BATCH_FAILED", cause);
    }
}
