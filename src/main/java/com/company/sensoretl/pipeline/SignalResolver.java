package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.LoadRecord;
import com.company.sensoretl.domain.NormalizedRow;
import com.company.sensoretl.domain.SignalRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Maps signal names to target ids by plain lookup in a registry snapshot.
 * Rows with unknown names are dropped; each unknown name is reported once.
 */
@Component
public class SignalResolver {

    public Resolution resolve(List<NormalizedRow> rows, SignalRegistry registry) {
        List<LoadRecord> records = new ArrayList<>(rows.size());
        Set<String> unresolved = new LinkedHashSet<>();

        for (NormalizedRow row : rows) {
            OptionalLong signalId = registry.lookup(row.getSignalName());
            if (signalId.isPresent()) {
                records.add(new LoadRecord(row.getTimestamp(), signalId.getAsLong(), row.getValue()));
            } else {
                unresolved.add(row.getSignalName());
            }
        }

        return new Resolution(List.copyOf(records), List.copyOf(unresolved));
    }
}
