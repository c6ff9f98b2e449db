package com.company.sensoretl.util;

import com.company.sensoretl.exception.PartitionValidationException;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

public class TimeUtils {

    private static final ZoneId PARTITION_ZONE = ZoneOffset.UTC;

    /**
     * Start of a partition day (UTC midnight), inclusive.
     */
    public static Instant partitionStart(LocalDate partitionDate) {
        return partitionDate.atStartOfDay(PARTITION_ZONE).toInstant();
    }

    /**
     * End of a partition day, exclusive.
     */
    public static Instant partitionEnd(LocalDate partitionDate) {
        return partitionDate.plusDays(1).atStartOfDay(PARTITION_ZONE).toInstant();
    }

    public static LocalDate today(Clock clock) {
        return LocalDate.now(clock.withZone(PARTITION_ZONE));
    }

    /**
     * Parse a {@code YYYY-MM-DD} partition argument.
     */
    public static LocalDate parsePartitionDate(String value) {
        if (value == null || value.isBlank()) {
            throw new PartitionValidationException("Partition date is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new PartitionValidationException("Invalid partition date '" + value + "', expected YYYY-MM-DD", e);
        }
    }

    /**
     * Source timestamps come either offset-qualified or naive; naive values are UTC.
     */
    public static Instant parseSourceTimestamp(String value) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    /**
     * Start of the epoch-anchored bucket containing {@code timestamp}.
     */
    public static Instant bucketStart(Instant timestamp, Duration width) {
        long widthMillis = width.toMillis();
        if (widthMillis < 1) {
            throw new IllegalArgumentException("Bucket width must be at least one millisecond: " + width);
        }
        long startMillis = Math.floorDiv(timestamp.toEpochMilli(), widthMillis) * widthMillis;
        return Instant.ofEpochMilli(startMillis);
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%ds", seconds);
        } else {
            return String.format("%dms", durationMs);
        }
    }

    public static String describeWidth(Duration width) {
        if (width.toMinutes() > 0 && width.toSecondsPart() == 0 && width.toMinutes() < 60) {
            return width.toMinutes() + "-minute";
        }
        if (width.toHours() > 0 && width.toMinutesPart() == 0 && width.toSecondsPart() == 0) {
            return width.toHours() + "-hour";
        }
        return width.toString();
    }
}
