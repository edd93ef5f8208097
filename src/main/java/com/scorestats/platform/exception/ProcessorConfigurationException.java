package com.scorestats.platform.exception;

public class ProcessorConfigurationException extends ScoreStatisticsException {
    public ProcessorConfigurationException(String message) {
        super(message, "PROCESSOR_CONFIGURATION");
    }
}
