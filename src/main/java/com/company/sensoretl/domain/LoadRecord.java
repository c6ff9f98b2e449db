package com.company.sensoretl.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Row shape appended to the target fact table.
 */
@Value
public class LoadRecord {
    Instant timestamp;
    long signalId;
    double value;
}
