package com.company.sensoretl.service;

import com.company.sensoretl.domain.PartitionRun;
import com.company.sensoretl.domain.enums.PartitionTrigger;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.repository.PartitionRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Entry point shared by every trigger: runs a partition and records the outcome in the run ledger.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PartitionRunService {

    private static final int MAX_ERROR_DETAIL_LENGTH = 2000;

    private final PartitionOrchestrator orchestrator;
    private final PartitionRunRepository runRepository;

    public PartitionResult run(LocalDate partitionDate, PartitionTrigger trigger) {
        PartitionResult result = orchestrator.processPartition(partitionDate);
        recordRun(result, trigger);
        return result;
    }

    public List<PartitionRun> findRuns(LocalDate from, LocalDate to) {
        return runRepository.findByPartitionDateBetween(from, to);
    }

    /**
     * Dates in {@code [from, to]} without a SUCCESS or NO_DATA run, oldest first.
     */
    public List<LocalDate> findPendingDates(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            return List.of();
        }

        Set<LocalDate> completed = runRepository.findCompletedDates(from, to);
        List<LocalDate> pending = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            if (!completed.contains(date)) {
                pending.add(date);
            }
        }
        return pending;
    }

    private void recordRun(PartitionResult result, PartitionTrigger trigger) {
        PartitionRun.PartitionRunBuilder run = PartitionRun.builder()
                .partitionDate(result.getPartitionDate())
                .status(result.getStatus().name())
                .triggeredBy(trigger.name())
                .recordsExtracted(result.getRecordsExtracted())
                .recordsInserted(result.getRecordsInserted())
                .bucketsProcessed(result.getBucketsProcessed())
                .startedAt(result.getStartedAt())
                .finishedAt(result.getFinishedAt());

        if (result instanceof PartitionResult.NoValidData) {
            run.unresolvedSignals(String.join(",", ((PartitionResult.NoValidData) result).getUnresolvedSignals()));
        }
        if (result instanceof PartitionResult.Failed) {
            PartitionResult.Failed failed = (PartitionResult.Failed) result;
            run.failedStage(failed.getFailedStage().name());
            run.errorDetail(truncate(failed.getErrorDetail()));
        }

        try {
            runRepository.save(run.build());
        } catch (Exception e) {
            // the ledger is bookkeeping; the partition outcome stands
            log.error("Failed to record run for partition {} ({})",
                    result.getPartitionDate(), result.getStatus(), e);
        }
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_ERROR_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_ERROR_DETAIL_LENGTH);
    }
}
