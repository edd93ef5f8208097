package com.scorestats.platform.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by batch workers between keys.
 */
public class CancellationSignal {
    
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    
    public void cancel() {
        cancelled.set(true);
    }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
}
