package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.PerformanceBlacklistEntry;
import com.scorestats.platform.model.PerformanceBlacklistEntryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PerformanceBlacklistJpaRepository extends JpaRepository<PerformanceBlacklistEntry, PerformanceBlacklistEntryId> {
}
