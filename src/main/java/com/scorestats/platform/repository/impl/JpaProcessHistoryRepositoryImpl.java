package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.ProcessHistory;
import com.scorestats.platform.repository.ProcessHistoryRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JpaProcessHistoryRepositoryImpl implements ProcessHistoryRepository {
    
    private final ProcessHistoryJpaRepository jpaRepository;
    
    @Autowired
    public JpaProcessHistoryRepositoryImpl(ProcessHistoryJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Optional<ProcessHistory> findByScoreId(long scoreId) {
        return jpaRepository.findById(scoreId);
    }
    
    @Override
    public ProcessHistory save(ProcessHistory processHistory) {
        return jpaRepository.save(processHistory);
    }
}
