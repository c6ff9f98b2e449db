package com.company.sensoretl.domain.enums;

public enum PartitionStatus {
    SUCCESS,
    NO_DATA,
    NO_VALID_DATA,
    ERROR;

    /**
     * Completed partitions are not picked up again by the scheduled triggers.
     */
    public boolean isCompleted() {
        return this == SUCCESS || this == NO_DATA;
    }

    public int getExitCode() {
        return isCompleted() ? 0 : 1;
    }

    public String toWireValue() {
        return name().toLowerCase();
    }
}
