package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.BucketStat;
import com.company.sensoretl.domain.RawSample;
import com.company.sensoretl.domain.SignalCatalog;
import com.company.sensoretl.domain.enums.StatKind;
import com.company.sensoretl.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Groups raw samples into fixed-width buckets anchored at the epoch and computes
 * mean, min, max and sample standard deviation per (bucket, metric).
 * <p>
 * Only pairs with at least one sample are emitted, so a bucket with no samples for any metric
 * never appears. Output order is bucket start, then catalog metric order, then {@link StatKind}
 * order, independent of input order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WindowedAggregator {

    private final SignalCatalog catalog;

    public AggregationResult aggregate(List<RawSample> samples, Duration bucketWidth) {
        if (bucketWidth == null || bucketWidth.toMillis() < 1) {
            throw new IllegalArgumentException("Bucket width must be at least one millisecond: " + bucketWidth);
        }
        if (samples.isEmpty()) {
            return new AggregationResult(List.of(), 0);
        }

        Map<Instant, Map<String, SampleStatistics>> buckets = new TreeMap<>();
        for (RawSample sample : samples) {
            if (!catalog.containsMetric(sample.getMetric())) {
                throw new IllegalStateException("Source returned a metric outside the catalog: " + sample.getMetric());
            }
            Instant bucketStart = TimeUtils.bucketStart(sample.getTimestamp(), bucketWidth);
            buckets.computeIfAbsent(bucketStart, key -> new TreeMap<>())
                    .computeIfAbsent(sample.getMetric(), key -> new SampleStatistics())
                    .accept(sample.getValue());
        }

        List<BucketStat> stats = new ArrayList<>();
        for (Map.Entry<Instant, Map<String, SampleStatistics>> bucket : buckets.entrySet()) {
            for (String metric : catalog.getMetrics()) {
                SampleStatistics accumulator = bucket.getValue().get(metric);
                if (accumulator == null) {
                    continue;
                }
                Instant start = bucket.getKey();
                stats.add(stat(start, metric, StatKind.MEAN, OptionalDouble.of(accumulator.getMean())));
                stats.add(stat(start, metric, StatKind.MIN, OptionalDouble.of(accumulator.getMin())));
                stats.add(stat(start, metric, StatKind.MAX, OptionalDouble.of(accumulator.getMax())));
                stats.add(stat(start, metric, StatKind.STDDEV, accumulator.getSampleStdDev()));
            }
        }

        log.debug("Aggregated {} samples into {} buckets of {}", samples.size(), buckets.size(), bucketWidth);
        return new AggregationResult(List.copyOf(stats), buckets.size());
    }

    private BucketStat stat(Instant bucketStart, String metric, StatKind kind, OptionalDouble value) {
        return new BucketStat(bucketStart, catalog.signal(metric, kind), value);
    }
}
