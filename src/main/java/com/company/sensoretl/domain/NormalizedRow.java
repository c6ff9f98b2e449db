package com.company.sensoretl.domain;

import lombok.Value;

import java.time.Instant;
import java.util.Comparator;

@Value
public class NormalizedRow {

    public static final Comparator<NormalizedRow> BY_TIMESTAMP_THEN_SIGNAL =
            Comparator.comparing(NormalizedRow::getTimestamp)
                    .thenComparing(row -> row.getSignal().asString());

    Instant timestamp;
    SignalName signal;
    double value;

    public String getSignalName() {
        return signal.asString();
    }
}
