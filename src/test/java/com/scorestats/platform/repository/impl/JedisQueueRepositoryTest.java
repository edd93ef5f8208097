package com.scorestats.platform.repository.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JedisQueueRepositoryTest {
    
    @Test
    void testIsAvailable_FalseBeforeInit() {
        // No pool has been created yet
        JedisQueueRepository repository = new JedisQueueRepository();
        
        assertFalse(repository.isAvailable());
    }
    
    @Test
    void testPop_NonPositiveBatchSizeReturnsEmpty() {
        // The pool is never touched when nothing is requested
        JedisQueueRepository repository = new JedisQueueRepository();
        
        assertTrue(repository.pop("osu-queue:score-statistics", 0).isEmpty());
        assertTrue(repository.pop("osu-queue:score-statistics", -1).isEmpty());
    }
}
