package com.company.sensoretl.repository;

import com.company.sensoretl.domain.PartitionRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.company.sensoretl.repository.SignalDataRepository.readUtc;
import static com.company.sensoretl.repository.SignalDataRepository.toUtc;

/**
 * Ledger of partition runs, one row per orchestrator invocation.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class PartitionRunRepository {

    private static final String SELECT_BASE = """
        SELECT run_id, partition_date, status, triggered_by,
               records_extracted, records_inserted, buckets_processed,
               unresolved_signals, failed_stage, error_detail,
               started_at, finished_at
        FROM partition_run
        """;

    private final JdbcTemplate jdbcTemplate;

    public PartitionRun save(PartitionRun run) {
        String sql = """
            INSERT INTO partition_run (
                partition_date, status, triggered_by,
                records_extracted, records_inserted, buckets_processed,
                unresolved_signals, failed_stage, error_detail,
                started_at, finished_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setObject(1, run.getPartitionDate());
            ps.setString(2, run.getStatus());
            ps.setString(3, run.getTriggeredBy());
            ps.setObject(4, run.getRecordsExtracted());
            ps.setObject(5, run.getRecordsInserted());
            ps.setObject(6, run.getBucketsProcessed());
            ps.setString(7, run.getUnresolvedSignals());
            ps.setString(8, run.getFailedStage());
            ps.setString(9, run.getErrorDetail());
            ps.setObject(10, toUtc(run.getStartedAt()));
            ps.setObject(11, toUtc(run.getFinishedAt()));
            return ps;
        }, keyHolder);

        // some drivers return every column of the inserted row, so look the id up by name
        Map<String, Object> keys = keyHolder.getKeys();
        Object key = keys != null ? keys.get("run_id") : null;
        if (key instanceof Number) {
            run.setRunId(((Number) key).longValue());
        }
        return run;
    }

    /**
     * Runs for partitions in {@code [from, to]}, newest partition first.
     */
    public List<PartitionRun> findByPartitionDateBetween(LocalDate from, LocalDate to) {
        String sql = SELECT_BASE + """
            WHERE partition_date >= ? AND partition_date <= ?
            ORDER BY partition_date DESC, finished_at DESC
            """;
        return jdbcTemplate.query(sql, new PartitionRunRowMapper(), from, to);
    }

    /**
     * Partition dates in {@code [from, to]} that have at least one SUCCESS or NO_DATA run.
     */
    public Set<LocalDate> findCompletedDates(LocalDate from, LocalDate to) {
        String sql = """
            SELECT DISTINCT partition_date
            FROM partition_run
            WHERE partition_date >= ? AND partition_date <= ?
            AND status IN ('SUCCESS', 'NO_DATA')
            """;
        List<LocalDate> dates = jdbcTemplate.query(sql,
                (rs, rowNum) -> rs.getObject("partition_date", LocalDate.class),
                from, to);
        return new HashSet<>(dates);
    }

    private static class PartitionRunRowMapper implements RowMapper<PartitionRun> {
        @Override
        public PartitionRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            return PartitionRun.builder()
                    .runId(rs.getLong("run_id"))
                    .partitionDate(rs.getObject("partition_date", LocalDate.class))
                    .status(rs.getString("status"))
                    .triggeredBy(rs.getString("triggered_by"))
                    .recordsExtracted(rs.getObject("records_extracted", Integer.class))
                    .recordsInserted(rs.getObject("records_inserted", Integer.class))
                    .bucketsProcessed(rs.getObject("buckets_processed", Integer.class))
                    .unresolvedSignals(rs.getString("unresolved_signals"))
                    .failedStage(rs.getString("failed_stage"))
                    .errorDetail(rs.getString("error_detail"))
                    .startedAt(readUtc(rs, "started_at"))
                    .finishedAt(readUtc(rs, "finished_at"))
                    .build();
        }
    }
}
