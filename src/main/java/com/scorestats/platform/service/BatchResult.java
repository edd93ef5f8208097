package com.scorestats.platform.service;

import lombok.Value;

@Value
public class BatchResult {
    int processed;
    int total;
    boolean cancelled;
}
