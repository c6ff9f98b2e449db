package com.company.sensoretl.repository;

import com.company.sensoretl.domain.SignalRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Signal definition table: the registry the pipeline resolves names against.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SignalRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public SignalRegistry loadRegistry() {
        Map<String, Long> idsByName = new HashMap<>();
        jdbcTemplate.query("SELECT id, name FROM signal", rs -> {
            idsByName.put(rs.getString("name"), rs.getLong("id"));
        });

        log.info("Loaded {} signals from target registry", idsByName.size());
        return new SignalRegistry(idsByName, clock.instant());
    }

    public List<String> findAllNames() {
        return jdbcTemplate.queryForList("SELECT name FROM signal ORDER BY id", String.class);
    }

    public int insert(String name, String description) {
        return jdbcTemplate.update(
                "INSERT INTO signal (name, description) VALUES (?, ?)", name, description);
    }
}
