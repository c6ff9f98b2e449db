package com.company.sensoretl.controller;

import com.company.sensoretl.domain.PartitionRun;
import com.company.sensoretl.domain.enums.PartitionTrigger;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.dto.response.PartitionResultResponse;
import com.company.sensoretl.exception.PartitionValidationException;
import com.company.sensoretl.service.PartitionRunService;
import com.company.sensoretl.util.TimeUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/partitions")
@Tag(name = "Partitions", description = "Run partitions on demand and inspect the run ledger")
@RequiredArgsConstructor
@Slf4j
public class PartitionController {

    private static final int DEFAULT_LOOKBACK_DAYS = 7;

    private final PartitionRunService runService;
    private final Clock clock;

    /**
     * Runs synchronously; always reprocesses, even if the ledger marks the date completed
     */
    @PostMapping("/{date}/run")
    @Operation(
            summary = "Run one partition",
            description = "Extract, aggregate, normalize, resolve and load one UTC calendar day"
    )
    public ResponseEntity<PartitionResultResponse> runPartition(
            @Parameter(description = "Partition date, YYYY-MM-DD") @PathVariable String date) {

        LocalDate partitionDate = TimeUtils.parsePartitionDate(date);
        log.info("Partition run requested via API for {}", partitionDate);

        PartitionResult result = runService.run(partitionDate, PartitionTrigger.API);
        return ResponseEntity.ok(PartitionResultResponse.from(result));
    }

    @GetMapping("/runs")
    @Operation(summary = "List recorded partition runs", description = "Defaults to the last 7 days")
    public ResponseEntity<List<PartitionRun>> getRuns(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {

        LocalDate toDate = to != null ? TimeUtils.parsePartitionDate(to) : TimeUtils.today(clock);
        LocalDate fromDate = from != null ? TimeUtils.parsePartitionDate(from) : toDate.minusDays(DEFAULT_LOOKBACK_DAYS);
        if (fromDate.isAfter(toDate)) {
            throw new PartitionValidationException("'from' must not be after 'to'");
        }

        return ResponseEntity.ok(runService.findRuns(fromDate, toDate));
    }
}
