package com.company.sensoretl.scheduled;

import com.company.sensoretl.config.EtlProperties;
import com.company.sensoretl.domain.enums.PartitionTrigger;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.service.PartitionRunService;
import com.company.sensoretl.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Cron triggers for partition runs. Both skip dates the run ledger marks as completed;
 * a failed date is picked up again on the next tick.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "sensor-etl.scheduling.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PartitionScheduleJob {

    private final PartitionRunService runService;
    private final EtlProperties properties;
    private final Clock clock;

    /**
     * Daily catch-up at 1 AM UTC: the last {@code catch-up-days} days up to yesterday
     */
    @Scheduled(cron = "${sensor-etl.scheduling.daily-cron:0 0 1 * * *}", zone = "UTC")
    public void runDailyCatchUp() {
        LocalDate today = TimeUtils.today(clock);
        LocalDate from = today.minusDays(properties.getScheduling().getCatchUpDays());
        LocalDate to = today.minusDays(1);

        log.info("Starting daily catch-up for {} .. {}", from, to);
        processPending(from, to, Integer.MAX_VALUE, PartitionTrigger.DAILY_SCHEDULE);
    }

    /**
     * Hourly backfill over the configured historical range
     */
    @Scheduled(cron = "${sensor-etl.scheduling.backfill-cron:0 0 * * * *}", zone = "UTC")
    public void runBackfill() {
        EtlProperties.Backfill backfill = properties.getScheduling().getBackfill();
        if (!backfill.isConfigured()) {
            log.debug("No backfill range configured");
            return;
        }

        log.info("Starting backfill tick for {} .. {}", backfill.getStartDate(), backfill.getEndDate());
        processPending(backfill.getStartDate(), backfill.getEndDate(),
                backfill.getMaxPartitionsPerTick(), PartitionTrigger.BACKFILL_SCHEDULE);
    }

    private void processPending(LocalDate from, LocalDate to, int limit, PartitionTrigger trigger) {
        List<LocalDate> pending;
        try {
            pending = runService.findPendingDates(from, to);
        } catch (Exception e) {
            log.error("Failed to read run ledger for {} .. {}", from, to, e);
            return;
        }

        if (pending.isEmpty()) {
            log.info("No pending partitions in {} .. {}", from, to);
            return;
        }

        int completedCount = 0;
        int failureCount = 0;

        for (LocalDate date : pending.subList(0, Math.min(limit, pending.size()))) {
            PartitionResult result = runService.run(date, trigger);
            if (result.getStatus().isCompleted()) {
                completedCount++;
            } else {
                failureCount++;
            }
        }

        log.info("{} finished: {} completed, {} not completed, {} still pending",
                trigger, completedCount, failureCount, Math.max(0, pending.size() - limit));
    }
}
