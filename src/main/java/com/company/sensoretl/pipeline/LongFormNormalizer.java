package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.BucketStat;
import com.company.sensoretl.domain.NormalizedRow;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Wide bucket statistics to (timestamp, signal, value) rows. Undefined values stop here.
 */
@Component
public class LongFormNormalizer {

    public List<NormalizedRow> normalize(List<BucketStat> stats) {
        return stats.stream()
                .filter(BucketStat::isDefined)
                .map(stat -> new NormalizedRow(stat.getBucketStart(), stat.getSignal(), stat.getValue().getAsDouble()))
                .sorted(NormalizedRow.BY_TIMESTAMP_THEN_SIGNAL)
                .collect(Collectors.toList());
    }
}
