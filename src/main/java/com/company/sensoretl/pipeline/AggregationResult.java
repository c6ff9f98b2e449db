package com.company.sensoretl.pipeline;

import com.company.sensoretl.domain.BucketStat;
import lombok.Value;

import java.util.List;

@Value
public class AggregationResult {
    List<BucketStat> stats;
    int bucketCount;

    public boolean isEmpty() {
        return stats.isEmpty();
    }
}
