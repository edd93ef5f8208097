package com.scorestats.platform.service;

import com.scorestats.platform.exception.BatchProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs a key list through a fixed number of workers.
 * <p>
 * The keys are split into contiguous ranges, one per worker, and each worker handles its range in order. The
 * cancellation signal is checked before every key, so a worker never stops halfway through one. If a key fails,
 * the other workers are cancelled and the failure is rethrown once all of them have stopped.
 */
public class PartitionedWorkerPool {
    
    private static final Logger logger = LoggerFactory.getLogger(PartitionedWorkerPool.class);
    
    private final String name;
    private final int workers;
    
    public PartitionedWorkerPool(String name, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1");
        }
        this.name = name;
        this.workers = workers;
    }
    
    /**
     * Splits {@code keys} into at most {@code count} contiguous, order preserving ranges whose sizes differ by at
     * most one.
     */
    public static <T> List<List<T>> partition(List<T> keys, int count) {
        List<List<T>> partitions = new ArrayList<>();
        
        if (keys.isEmpty()) {
            return partitions;
        }
        
        int parts = Math.min(count, keys.size());
        int size = keys.size() / parts;
        int remainder = keys.size() % parts;
        int start = 0;
        
        for (int i = 0; i < parts; i++) {
            int end = start + size + (i < remainder ? 1 : 0);
            partitions.add(keys.subList(start, end));
            start = end;
        }
        
        return partitions;
    }
    
    public <T> BatchResult run(List<T> keys, CancellationSignal cancellation, Consumer<T> action) {
        List<List<T>> partitions = partition(keys, workers);
        AtomicInteger processed = new AtomicInteger();
        
        if (partitions.isEmpty()) {
            return new BatchResult(0, 0, cancellation.isCancelled());
        }
        
        logger.info("Starting {} for {} keys on {} workers", name, keys.size(), partitions.size());
        
        ExecutorService executor = Executors.newFixedThreadPool(partitions.size());
        List<Future<?>> futures = new ArrayList<>();
        
        try {
            for (List<T> partition : partitions) {
                futures.add(executor.submit(() -> {
                    for (T key : partition) {
                        if (cancellation.isCancelled()) {
                            return;
                        }
                        
                        action.accept(key);
                        
                        int count = processed.incrementAndGet();
                        logger.debug("{}: processed {} of {}", name, count, keys.size());
                    }
                }));
            }
            
            Throwable failure = null;
            
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    cancellation.cancel();
                    if (failure == null) {
                        failure = e.getCause();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellation.cancel();
                    throw new BatchProcessingException(name + " was interrupted", e);
                }
            }
            
            if (failure != null) {
                throw new BatchProcessingException(name + " failed after " + processed.get() + " of " + keys.size() + " keys", failure);
            }
        } finally {
            executor.shutdown();
        }
        
        logger.info("Finished {}: processed {} of {}{}", name, processed.get(), keys.size(),
            cancellation.isCancelled() ? " (cancelled)" : "");
        
        return new BatchResult(processed.get(), keys.size(), cancellation.isCancelled());
    }
}
