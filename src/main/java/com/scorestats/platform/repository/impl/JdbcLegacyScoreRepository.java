package com.scorestats.platform.repository.impl;

import com.scorestats.platform.model.Ruleset;
import com.scorestats.platform.repository.LegacyScoreRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcLegacyScoreRepository implements LegacyScoreRepository {
    
    private final JdbcTemplate jdbcTemplate;
    
    @Autowired
    public JdbcLegacyScoreRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    @Override
    public void updatePerformance(Ruleset ruleset, long legacyScoreId, double pp) {
        // Table names come from the enum, never from input.
        String sql = "UPDATE " + ruleset.getLegacyHighScoreTable() + " SET pp = ? WHERE score_id = ?";
        jdbcTemplate.update(sql, pp, legacyScoreId);
    }
}
