package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Build;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BuildJpaRepository extends JpaRepository<Build, Integer> {
}
