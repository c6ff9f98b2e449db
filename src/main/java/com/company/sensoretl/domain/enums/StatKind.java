package com.company.sensoretl.domain.enums;

/**
 * Per-bucket statistic computed for every configured metric.
 */
public enum StatKind {
    MEAN("mean", "Mean"),
    MIN("min", "Minimum"),
    MAX("max", "Maximum"),
    STDDEV("stddev", "Sample standard deviation");

    private final String suffix;
    private final String label;

    StatKind(String suffix, String label) {
        this.suffix = suffix;
        this.label = label;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getLabel() {
        return label;
    }
}
