package com.familyledger.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class HealthRepository {

    private final JdbcTemplate jdbc;

    public HealthRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /** Runs a trivial query; throws a {@code DataAccessException} when the database is unreachable. */
    public void ping() {
        jdbc.queryForObject("SELECT 1", Integer.class);
    }
}
