package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.DescriptiveStats;

import java.util.OptionalDouble;

/**
 * Streaming mean/min/max/variance accumulator (Welford). Standard deviation is the sample
 * deviation with an n-1 denominator and is undefined below two values.
 */
public final class SampleStatistics {

    private long count;
    private double mean;
    private double m2;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public void accept(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        requireSamples();
        return mean;
    }

    public double getMin() {
        requireSamples();
        return min;
    }

    public double getMax() {
        requireSamples();
        return max;
    }

    public OptionalDouble getSampleStdDev() {
        if (count < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(m2 / (count - 1)));
    }

    public DescriptiveStats toDescriptiveStats() {
        OptionalDouble stddev = getSampleStdDev();
        return DescriptiveStats.builder()
                .count(count)
                .mean(getMean())
                .min(getMin())
                .max(getMax())
                .stddev(stddev.isPresent() ? stddev.getAsDouble() : null)
                .build();
    }

    private void requireSamples() {
        if (count == 0) {
            throw new IllegalStateException("No samples accumulated");
        }
    }
}
