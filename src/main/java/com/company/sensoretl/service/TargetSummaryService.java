package com.company.sensoretl.service;

import com.company.sensoretl.dto.response.TargetSummaryResponse;
import com.company.sensoretl.repository.SignalDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only overview of what has been loaded into the target store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TargetSummaryService {

    private final SignalDataRepository dataRepository;

    public TargetSummaryResponse summarize() {
        long total = dataRepository.countAll();
        Map<String, Instant> range = dataRepository.findTimestampRange();

        List<TargetSummaryResponse.SignalSummary> signals = dataRepository.findSignalStatistics().stream()
                .map(row -> TargetSummaryResponse.SignalSummary.builder()
                        .signalId(getLongValue(row, "signal_id"))
                        .name((String) row.get("signal_name"))
                        .recordCount(getLongValue(row, "record_count", 0L))
                        .avgValue(getDoubleValue(row, "avg_value"))
                        .minValue(getDoubleValue(row, "min_value"))
                        .maxValue(getDoubleValue(row, "max_value"))
                        .build())
                .collect(Collectors.toList());

        List<TargetSummaryResponse.DailyCount> daily = dataRepository.findDailyDistribution().stream()
                .map(row -> TargetSummaryResponse.DailyCount.builder()
                        .day(getDateValue(row, "partition_day"))
                        .recordCount(getLongValue(row, "record_count", 0L))
                        .build())
                .collect(Collectors.toList());

        log.debug("Target summary: {} records, {} signals, {} days", total, signals.size(), daily.size());

        return TargetSummaryResponse.builder()
                .totalRecords(total)
                .minTimestamp(range.get("min_timestamp"))
                .maxTimestamp(range.get("max_timestamp"))
                .signals(signals)
                .dailyDistribution(daily)
                .build();
    }

    // Helper methods to safely extract values from Map
    private Long getLongValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return null;
    }

    private long getLongValue(Map<String, Object> map, String key, long defaultValue) {
        Long value = getLongValue(map, key);
        return value != null ? value : defaultValue;
    }

    private Double getDoubleValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

    private LocalDate getDateValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        return null;
    }
}
