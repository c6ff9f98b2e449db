package com.company.sensoretl.service;

import com.company.sensoretl.config.EtlProperties;
import com.company.sensoretl.domain.DescriptiveStats;
import com.company.sensoretl.domain.NormalizedRow;
import com.company.sensoretl.domain.RawSample;
import com.company.sensoretl.domain.SignalCatalog;
import com.company.sensoretl.domain.SignalRegistry;
import com.company.sensoretl.domain.enums.PartitionStage;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.exception.LoadFailureException;
import com.company.sensoretl.pipeline.AggregationResult;
import com.company.sensoretl.pipeline.BatchLoader;
import com.company.sensoretl.pipeline.LongFormNormalizer;
import com.company.sensoretl.pipeline.Resolution;
import com.company.sensoretl.pipeline.SampleStatistics;
import com.company.sensoretl.pipeline.SignalResolver;
import com.company.sensoretl.pipeline.WindowedAggregator;
import com.company.sensoretl.repository.SignalRepository;
import com.company.sensoretl.source.SourceReader;
import com.company.sensoretl.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs extract, aggregate, normalize, resolve and load for one calendar-day partition.
 * <p>
 * Stages run strictly in sequence. Every fault is converted into a {@link PartitionResult.Failed};
 * nothing is thrown to the caller. The only state kept between runs is the signal registry
 * snapshot, which is immutable and replaced as a whole.
 */
@Service
@Slf4j
public class PartitionOrchestrator {

    private static final String MDC_PARTITION_KEY = "partition";

    private final SourceReader sourceReader;
    private final WindowedAggregator aggregator;
    private final LongFormNormalizer normalizer;
    private final SignalResolver resolver;
    private final BatchLoader loader;
    private final SignalRepository signalRepository;
    private final SignalCatalog catalog;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;
    private final Duration bucketWidth;
    private final boolean refreshRegistryPerRun;

    private volatile SignalRegistry registrySnapshot;

    public PartitionOrchestrator(SourceReader sourceReader,
                                 WindowedAggregator aggregator,
                                 LongFormNormalizer normalizer,
                                 SignalResolver resolver,
                                 BatchLoader loader,
                                 SignalRepository signalRepository,
                                 SignalCatalog catalog,
                                 EtlProperties properties,
                                 MeterRegistry meterRegistry,
                                 Tracer tracer,
                                 Clock clock) {
        this.sourceReader = sourceReader;
        this.aggregator = aggregator;
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.loader = loader;
        this.signalRepository = signalRepository;
        this.catalog = catalog;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
        this.clock = clock;
        this.bucketWidth = properties.getAggregation().getBucketWidth();
        this.refreshRegistryPerRun = properties.getRegistry().isRefreshPerRun();
    }

    public PartitionResult processPartition(LocalDate partitionDate) {
        Instant startedAt = clock.instant();
        Span span = tracer.spanBuilder("etl.partition")
                .setAttribute("partition.date", partitionDate.toString())
                .startSpan();
        MDC.put(MDC_PARTITION_KEY, partitionDate.toString());

        try (Scope ignored = span.makeCurrent()) {
            log.info("Starting partition {}", partitionDate);

            PartitionResult result = execute(partitionDate, startedAt);

            span.setAttribute("partition.status", result.getStatus().name());
            span.setAttribute("partition.records_inserted", result.getRecordsInserted());
            if (result instanceof PartitionResult.Failed) {
                span.setStatus(StatusCode.ERROR, ((PartitionResult.Failed) result).getErrorDetail());
            }
            recordMetrics(result);

            log.info("Partition {} finished: status={}, extracted={}, buckets={}, inserted={}",
                    partitionDate, result.getStatus(), result.getRecordsExtracted(),
                    result.getBucketsProcessed(), result.getRecordsInserted());
            return result;
        } finally {
            span.end();
            MDC.remove(MDC_PARTITION_KEY);
        }
    }

    /**
     * Replace the registry snapshot with a fresh read of the signal table.
     */
    public SignalRegistry refreshRegistry() {
        SignalRegistry fresh = signalRepository.loadRegistry();
        registrySnapshot = fresh;
        log.debug("Registry snapshot replaced: {} signals as of {}", fresh.size(), fresh.getLoadedAt());
        return fresh;
    }

    private PartitionResult execute(LocalDate partitionDate, Instant startedAt) {
        PartitionStage stage = PartitionStage.EXTRACTING;
        int extracted = 0;
        int buckets = 0;

        try {
            List<RawSample> samples = sourceReader.readSamples(
                    TimeUtils.partitionStart(partitionDate),
                    TimeUtils.partitionEnd(partitionDate),
                    catalog.getMetrics());
            extracted = samples.size();

            if (samples.isEmpty()) {
                log.warn("No source data for partition {}", partitionDate);
                return PartitionResult.noData(partitionDate, startedAt, clock.instant());
            }

            stage = PartitionStage.AGGREGATING;
            AggregationResult aggregation = aggregator.aggregate(samples, bucketWidth);
            buckets = aggregation.getBucketCount();
            log.info("Aggregated {} samples into {} buckets", extracted, buckets);

            stage = PartitionStage.NORMALIZING;
            List<NormalizedRow> rows = normalizer.normalize(aggregation.getStats());
            log.info("Normalized to {} long-form rows", rows.size());

            stage = PartitionStage.RESOLVING;
            Resolution resolution = resolver.resolve(rows, currentRegistry());
            if (resolution.hasUnresolved()) {
                log.warn("Signals missing from registry, rows dropped: {}", resolution.getUnresolvedSignals());
            }
            if (resolution.getRecords().isEmpty()) {
                log.warn("No resolvable rows for partition {} ({} rows generated)", partitionDate, rows.size());
                return PartitionResult.noValidData(partitionDate, extracted, buckets,
                        resolution.getUnresolvedSignals(), startedAt, clock.instant());
            }

            stage = PartitionStage.LOADING;
            int inserted = loader.load(resolution.getRecords());

            return PartitionResult.success(partitionDate, extracted, inserted, buckets,
                    describeInput(samples), startedAt, clock.instant());

        } catch (LoadFailureException e) {
            log.error("Load failed for partition {} after {} rows", partitionDate, e.getRowsCommitted(), e);
            return PartitionResult.failed(partitionDate, extracted, e.getRowsCommitted(), buckets,
                    stage, describe(e), startedAt, clock.instant());
        } catch (Exception e) {
            log.error("Partition {} failed while {}", partitionDate, stage, e);
            return PartitionResult.failed(partitionDate, extracted, 0, buckets,
                    stage, describe(e), startedAt, clock.instant());
        }
    }

    private SignalRegistry currentRegistry() {
        SignalRegistry snapshot = registrySnapshot;
        if (snapshot == null || refreshRegistryPerRun) {
            snapshot = refreshRegistry();
        }
        return snapshot;
    }

    private Map<String, DescriptiveStats> describeInput(List<RawSample> samples) {
        Map<String, SampleStatistics> byMetric = new LinkedHashMap<>();
        for (RawSample sample : samples) {
            byMetric.computeIfAbsent(sample.getMetric(), key -> new SampleStatistics())
                    .accept(sample.getValue());
        }

        Map<String, DescriptiveStats> stats = new LinkedHashMap<>();
        byMetric.forEach((metric, accumulator) -> stats.put(metric, accumulator.toDescriptiveStats()));
        return stats;
    }

    private void recordMetrics(PartitionResult result) {
        meterRegistry.counter("etl.partitions.processed",
                "status", result.getStatus().name()
        ).increment();
        meterRegistry.counter("etl.records.extracted").increment(result.getRecordsExtracted());
        meterRegistry.counter("etl.records.inserted").increment(result.getRecordsInserted());
        meterRegistry.timer("etl.partition.duration",
                "status", result.getStatus().name()
        ).record(Duration.between(result.getStartedAt(), result.getFinishedAt()));
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getName();
    }
}
