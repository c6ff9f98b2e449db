package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.LoadRecord;
import lombok.Value;

import java.util.List;

@Value
public class Resolution {
    List<LoadRecord> records;
    List<String> unresolvedSignals; // distinct, first-seen order

    public boolean hasUnresolved() {
        return !unresolvedSignals.isEmpty();
    }
}
