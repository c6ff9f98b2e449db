package com.company.sensoretl.domain;

import lombok.Value;

import java.time.Instant;
import java.util.OptionalDouble;

@Value
public class BucketStat {
    Instant bucketStart;
    SignalName signal;
    OptionalDouble value; // empty for stddev of a single-sample bucket

    public boolean isDefined() {
        return value.isPresent();
    }
}
