package com.company.sensoretl.support;

import com.company.sensoretl.domain.RawSample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Samples {

    private Samples() {
    }

    /**
     * One sample per minute starting at {@code start}, one per value.
     */
    public static List<RawSample> perMinute(String metric, Instant start, double... values) {
        List<RawSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(new RawSample(start.plusSeconds(60L * i), metric, values[i]));
        }
        return samples;
    }
}
