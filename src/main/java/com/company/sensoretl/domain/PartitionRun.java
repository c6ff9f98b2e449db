package com.company.sensoretl.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Ledger entry written for every orchestrated partition run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionRun {
    private Long runId;
    private LocalDate partitionDate;
    private String status;
    private String triggeredBy;
    private Integer recordsExtracted;
    private Integer recordsInserted;
    private Integer bucketsProcessed;
    private String unresolvedSignals; // comma separated
    private String failedStage;
    private String errorDetail;
    private Instant startedAt;
    private Instant finishedAt;
}
