package com.company.sensoretl.domain.enums;

public enum PartitionStage {
    EXTRACTING,
    AGGREGATING,
    NORMALIZING,
    RESOLVING,
    LOADING
}
