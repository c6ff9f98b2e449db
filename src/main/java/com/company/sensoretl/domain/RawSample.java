package com.company.sensoretl.domain;

import lombok.Value;

import java.time.Instant;

/**
 * One source reading of one metric at one minute.
 */
@Value
public class RawSample {
    Instant timestamp;
    String metric;
    double value;
}
