package com.scorestats.platform.repository;

import com.scorestats.platform.model.ProcessHistory;

import java.util.Optional;

public interface ProcessHistoryRepository {
    Optional<ProcessHistory> findByScoreId(long scoreId);
    ProcessHistory save(ProcessHistory processHistory);
}
