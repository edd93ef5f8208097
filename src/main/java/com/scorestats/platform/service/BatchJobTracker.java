package com.scorestats.platform.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the cancellation signals of running batch jobs so they can be stopped on request.
 */
@Component
public class BatchJobTracker {
    
    private static final Logger logger = LoggerFactory.getLogger(BatchJobTracker.class);
    
    private final Set<CancellationSignal> running = ConcurrentHashMap.newKeySet();
    
    public CancellationSignal start() {
        CancellationSignal signal = new CancellationSignal();
        running.add(signal);
        return signal;
    }
    
    public void finish(CancellationSignal signal) {
        running.remove(signal);
    }
    
    /**
     * @return how many running jobs were signalled
     */
    public int cancelAll() {
        int count = 0;
        for (CancellationSignal signal : running) {
            signal.cancel();
            count++;
        }
        logger.info("Requested cancellation of {} batch jobs", count);
        return count;
    }
}
