package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Build;
import com.scorestats.platform.repository.BuildRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JpaBuildRepositoryImpl implements BuildRepository {
    
    private final BuildJpaRepository jpaRepository;
    
    @Autowired
    public JpaBuildRepositoryImpl(BuildJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public List<Build> findAll() {
        return jpaRepository.findAll();
    }
}
