package com.company.sensoretl.service;

import com.company.sensoretl.dto.response.TargetSummaryResponse;
import com.company.sensoretl.repository.SignalDataRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TargetSummaryServiceTest {

    @Mock
    private SignalDataRepository dataRepository;

    @InjectMocks
    private TargetSummaryService summaryService;

    @Test
    void summarize_shouldMapRepositoryRows() {
        Instant min = Instant.parse("2025-08-10T00:00:00Z");
        Instant max = Instant.parse("2025-08-10T23:50:00Z");

        Map<String, Instant> range = new HashMap<>();
        range.put("min_timestamp", min);
        range.put("max_timestamp", max);

        Map<String, Object> loaded = new HashMap<>();
        loaded.put("signal_id", 1);
        loaded.put("signal_name", "wind_speed_mean");
        loaded.put("record_count", 144L);
        loaded.put("avg_value", 7.25);
        loaded.put("min_value", 0.5);
        loaded.put("max_value", 15.0);

        Map<String, Object> empty = new HashMap<>();
        empty.put("signal_id", 2L);
        empty.put("signal_name", "wind_speed_stddev");
        empty.put("record_count", 0L);
        empty.put("avg_value", null);

        when(dataRepository.countAll()).thenReturn(144L);
        when(dataRepository.findTimestampRange()).thenReturn(range);
        when(dataRepository.findSignalStatistics()).thenReturn(List.of(loaded, empty));
        when(dataRepository.findDailyDistribution()).thenReturn(List.of(
                Map.of("partition_day", Date.valueOf(LocalDate.of(2025, 8, 10)), "record_count", 144L)));

        TargetSummaryResponse summary = summaryService.summarize();

        assertEquals(144L, summary.getTotalRecords());
        assertEquals(min, summary.getMinTimestamp());
        assertEquals(max, summary.getMaxTimestamp());
        assertEquals(2, summary.getSignals().size());
        assertEquals(1L, summary.getSignals().get(0).getSignalId());
        assertEquals(7.25, summary.getSignals().get(0).getAvgValue());
        assertNull(summary.getSignals().get(1).getAvgValue());
        assertEquals(LocalDate.of(2025, 8, 10), summary.getDailyDistribution().get(0).getDay());
        assertEquals(144L, summary.getDailyDistribution().get(0).getRecordCount());
    }

    @Test
    void summarize_shouldHandleEmptyStore() {
        Map<String, Instant> range = new HashMap<>();
        range.put("min_timestamp", null);
        range.put("max_timestamp", null);
        when(dataRepository.countAll()).thenReturn(0L);
        when(dataRepository.findTimestampRange()).thenReturn(range);
        when(dataRepository.findSignalStatistics()).thenReturn(List.of());
        when(dataRepository.findDailyDistribution()).thenReturn(List.of());

        TargetSummaryResponse summary = summaryService.summarize();

        assertEquals(0L, summary.getTotalRecords());
        assertNull(summary.getMinTimestamp());
        assertEquals(0, summary.getSignals().size());
    }
}
