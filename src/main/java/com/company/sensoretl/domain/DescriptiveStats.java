package com.company.sensoretl.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of the raw input of one metric for a partition, reported with a successful run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DescriptiveStats {
    private long count;
    private double mean;
    private double min;
    private double max;
    private Double stddev; // null below two samples
}
