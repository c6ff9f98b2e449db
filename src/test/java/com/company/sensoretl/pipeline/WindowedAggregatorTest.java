package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.BucketStat;
import com.company.sensoretl.domain.RawSample;
import com.company.sensoretl.domain.SignalCatalog;
import com.company.sensoretl.domain.enums.StatKind;
import com.company.sensoretl.support.Samples;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowedAggregatorTest {

    private static final Duration TEN_MINUTES = Duration.ofMinutes(10);
    private static final Instant DAY = Instant.parse("2025-08-10T00:00:00Z");

    private final SignalCatalog catalog = SignalCatalog.of(List.of("wind_speed", "power"), null);
    private final WindowedAggregator aggregator = new WindowedAggregator(catalog);

    @Test
    void aggregate_shouldComputeStatisticsForTenSampleBucket() {
        List<RawSample> samples = Samples.perMinute("wind_speed", DAY.plusSeconds(600),
                5, 6, 7, 8, 9, 10, 11, 12, 13, 14);

        AggregationResult result = aggregator.aggregate(samples, TEN_MINUTES);

        assertEquals(1, result.getBucketCount());
        assertEquals(4, result.getStats().size());
        assertEquals(9.5, value(result, StatKind.MEAN), 1e-9);
        assertEquals(5.0, value(result, StatKind.MIN), 1e-9);
        assertEquals(14.0, value(result, StatKind.MAX), 1e-9);
        // sample deviation of 5..14: sqrt(82.5 / 9)
        assertEquals(Math.sqrt(82.5 / 9), value(result, StatKind.STDDEV), 1e-9);
        result.getStats().forEach(stat -> assertEquals(DAY.plusSeconds(600), stat.getBucketStart()));
    }

    @Test
    void aggregate_shouldAnchorBucketsToAbsoluteTime() {
        // 00:07 .. 00:12 spans the 00:00 and 00:10 buckets
        List<RawSample> samples = Samples.perMinute("power", DAY.plusSeconds(7 * 60), 1, 2, 3, 4, 5, 6);

        AggregationResult result = aggregator.aggregate(samples, TEN_MINUTES);

        assertEquals(2, result.getBucketCount());
        List<Instant> starts = result.getStats().stream()
                .map(BucketStat::getBucketStart).distinct().collect(Collectors.toList());
        assertEquals(List.of(DAY, DAY.plusSeconds(600)), starts);
    }

    @Test
    void aggregate_shouldLeaveStddevUndefinedForSingleSampleBucket() {
        List<RawSample> samples = List.of(new RawSample(DAY.plusSeconds(60), "wind_speed", 7.25));

        AggregationResult result = aggregator.aggregate(samples, TEN_MINUTES);

        assertEquals(7.25, value(result, StatKind.MEAN), 1e-9);
        assertEquals(7.25, value(result, StatKind.MIN), 1e-9);
        assertEquals(7.25, value(result, StatKind.MAX), 1e-9);
        BucketStat stddev = find(result, "wind_speed", StatKind.STDDEV);
        assertFalse(stddev.isDefined());
    }

    @Test
    void aggregate_shouldBeIndependentOfInputOrder() {
        List<RawSample> samples = new ArrayList<>();
        samples.addAll(Samples.perMinute("wind_speed", DAY, 3, 1, 4, 1, 5, 9, 2, 6, 5, 3, 5, 8));
        samples.addAll(Samples.perMinute("power", DAY.plusSeconds(300), 120, 80, 95, 101, 77, 64, 200));

        List<RawSample> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(42));

        AggregationResult first = aggregator.aggregate(samples, TEN_MINUTES);
        AggregationResult second = aggregator.aggregate(shuffled, TEN_MINUTES);

        assertEquals(first.getBucketCount(), second.getBucketCount());
        assertEquals(keys(first), keys(second));
        for (int i = 0; i < first.getStats().size(); i++) {
            BucketStat a = first.getStats().get(i);
            BucketStat b = second.getStats().get(i);
            assertEquals(a.getBucketStart(), b.getBucketStart());
            assertEquals(a.getSignal(), b.getSignal());
            assertEquals(a.getValue().isPresent(), b.getValue().isPresent());
            if (a.getValue().isPresent()) {
                assertEquals(a.getValue().getAsDouble(), b.getValue().getAsDouble(), 1e-9);
            }
        }
    }

    @Test
    void aggregate_shouldOnlyEmitMetricsPresentInBucket() {
        List<RawSample> samples = new ArrayList<>();
        samples.addAll(Samples.perMinute("wind_speed", DAY, 1, 2));
        samples.addAll(Samples.perMinute("power", DAY.plusSeconds(3600), 10, 20));

        AggregationResult result = aggregator.aggregate(samples, TEN_MINUTES);

        assertEquals(2, result.getBucketCount());
        assertTrue(result.getStats().stream()
                .filter(stat -> stat.getBucketStart().equals(DAY))
                .allMatch(stat -> stat.getSignal().getMetric().equals("wind_speed")));
        assertTrue(result.getStats().stream()
                .filter(stat -> stat.getBucketStart().equals(DAY.plusSeconds(3600)))
                .allMatch(stat -> stat.getSignal().getMetric().equals("power")));
    }

    @Test
    void aggregate_shouldReturnEmptyResultForEmptyInput() {
        AggregationResult result = aggregator.aggregate(List.of(), TEN_MINUTES);

        assertTrue(result.isEmpty());
        assertEquals(0, result.getBucketCount());
    }

    @Test
    void aggregate_shouldRejectNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.aggregate(List.of(), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.aggregate(List.of(new RawSample(DAY, "power", 1.0)), Duration.ofNanos(10)));
    }

    private double value(AggregationResult result, StatKind kind) {
        return find(result, "wind_speed", kind).getValue().getAsDouble();
    }

    private BucketStat find(AggregationResult result, String metric, StatKind kind) {
        return result.getStats().stream()
                .filter(stat -> stat.getSignal().equals(catalog.signal(metric, kind)))
                .findFirst()
                .orElseThrow();
    }

    private static HashSet<String> keys(AggregationResult result) {
        return result.getStats().stream()
                .map(stat -> stat.getBucketStart() + "/" + stat.getSignal())
                .collect(Collectors.toCollection(HashSet::new));
    }
}
