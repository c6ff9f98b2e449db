package com.company.sensoretl.repository;

import com.company.sensoretl.domain.LoadRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only access to the {@code data} fact table.
 * <p>
 * {@code data.timestamp} has no zone; values are bound and read as UTC wall-clock time,
 * never through the JVM default zone.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class SignalDataRepository {

    private static final String INSERT_SQL =
            "INSERT INTO data (timestamp, signal_id, value) VALUES (?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Insert one batch in a single JDBC round trip.
     *
     * @return rows written
     */
    public int insertBatch(List<LoadRecord> batch) {
        if (batch.isEmpty()) {
            return 0;
        }

        int[][] counts = jdbcTemplate.batchUpdate(INSERT_SQL, batch, batch.size(), (ps, record) -> {
            ps.setObject(1, toUtc(record.getTimestamp()));
            ps.setLong(2, record.getSignalId());
            ps.setDouble(3, record.getValue());
        });

        // drivers may report SUCCESS_NO_INFO (-2) instead of a row count
        return Arrays.stream(counts)
                .flatMapToInt(Arrays::stream)
                .map(count -> count < 0 ? 1 : count)
                .sum();
    }

    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM data", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * @return {@code min_timestamp} and {@code max_timestamp} as {@link Instant}, null on an empty table
     */
    public Map<String, Instant> findTimestampRange() {
        return jdbcTemplate.queryForObject(
                "SELECT MIN(timestamp) AS min_timestamp, MAX(timestamp) AS max_timestamp FROM data",
                (rs, rowNum) -> {
                    Map<String, Instant> range = new HashMap<>();
                    range.put("min_timestamp", readUtc(rs, "min_timestamp"));
                    range.put("max_timestamp", readUtc(rs, "max_timestamp"));
                    return range;
                });
    }

    public List<Map<String, Object>> findSignalStatistics() {
        String sql = """
                SELECT s.id AS signal_id, s.name AS signal_name,
                       COUNT(d.id) AS record_count,
                       AVG(d.value) AS avg_value,
                       MIN(d.value) AS min_value,
                       MAX(d.value) AS max_value
                FROM signal s
                LEFT JOIN data d ON d.signal_id = s.id
                GROUP BY s.id, s.name
                ORDER BY s.id
                """;
        return jdbcTemplate.queryForList(sql);
    }

    public List<Map<String, Object>> findDailyDistribution() {
        String sql = """
                SELECT CAST(timestamp AS DATE) AS partition_day, COUNT(*) AS record_count
                FROM data
                GROUP BY CAST(timestamp AS DATE)
                ORDER BY partition_day
                """;
        return jdbcTemplate.queryForList(sql);
    }

    static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant readUtc(ResultSet rs, String column) throws SQLException {
        LocalDateTime value = rs.getObject(column, LocalDateTime.class);
        return value != null ? value.toInstant(ZoneOffset.UTC) : null;
    }
}
