package com.scorestats.platform.repository;

import java.util.List;

public interface QueueRepository {
    List<String> pop(String queueName, int maxItems);
    void push(String queueName, String payload);
    void publish(String channel, String payload);
    boolean isAvailable();
}
