package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.ProcessHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessHistoryJpaRepository extends JpaRepository<ProcessHistory, Long> {
}
