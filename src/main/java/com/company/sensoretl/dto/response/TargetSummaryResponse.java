package com.company.sensoretl.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetSummaryResponse {
    private long totalRecords;
    private Instant minTimestamp;
    private Instant maxTimestamp;
    private List<SignalSummary> signals;
    private List<DailyCount> dailyDistribution;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignalSummary {
        private Long signalId;
        private String name;
        private long recordCount;
        private Double avgValue;
        private Double minValue;
        private Double maxValue;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyCount {
        private LocalDate day;
        private long recordCount;
    }
}
