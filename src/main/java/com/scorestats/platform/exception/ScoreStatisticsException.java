package com.scorestats.platform.exception;

public class ScoreStatisticsException extends RuntimeException {
    private final String errorCode;
    
    public ScoreStatisticsException(String message) {
        super(message);
        this.errorCode = "SCORE_STATISTICS_ERROR";
    }
    
    public ScoreStatisticsException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public ScoreStatisticsException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCORE_STATISTICS_ERROR";
    }
    
    public ScoreStatisticsException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
