package com.company.sensoretl.domain.enums;

public enum PartitionTrigger {
    DAILY_SCHEDULE,
    BACKFILL_SCHEDULE,
    COMMAND_LINE,
    API
}
