package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Medal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MedalJpaRepository extends JpaRepository<Medal, Integer> {
    List<Medal> findAllByOrderByOrderingAscAchievementIdAsc();
}
