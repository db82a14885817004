package com.tsl.search.retrieval;

import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CandidateRepository {
    private final JdbcTemplate jdbcTemplate;

    public CandidateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Map<String, Object>> findCandidates(HybridQuery query) {
        return jdbcTemplate.queryForList(query.getSql(), query.getArgs().toArray());
    }
}
