package com.company.sensoretl.cli;

import com.company.sensoretl.domain.DescriptiveStats;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.util.TimeUtils;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable summary printed by the one-shot command.
 */
public final class PartitionResultFormatter {

    private PartitionResultFormatter() {
    }

    public static String format(PartitionResult result) {
        StringBuilder out = new StringBuilder();
        out.append("ETL result for ").append(result.getPartitionDate()).append(System.lineSeparator());
        line(out, "Status", result.getStatus().toWireValue());
        line(out, "Duration", TimeUtils.formatDuration(
                Duration.between(result.getStartedAt(), result.getFinishedAt()).toMillis()));

        if (result instanceof PartitionResult.Success) {
            line(out, "Records extracted", result.getRecordsExtracted());
            line(out, "Buckets processed", result.getBucketsProcessed());
            line(out, "Records inserted", result.getRecordsInserted());
            for (Map.Entry<String, DescriptiveStats> entry
                    : ((PartitionResult.Success) result).getInputStatistics().entrySet()) {
                line(out, "Input " + entry.getKey(), describe(entry.getValue()));
            }
        } else if (result instanceof PartitionResult.NoData) {
            out.append("No source data found for the requested date").append(System.lineSeparator());
        } else if (result instanceof PartitionResult.NoValidData) {
            line(out, "Records extracted", result.getRecordsExtracted());
            line(out, "Unresolved signals",
                    String.join(", ", ((PartitionResult.NoValidData) result).getUnresolvedSignals()));
        } else if (result instanceof PartitionResult.Failed) {
            PartitionResult.Failed failed = (PartitionResult.Failed) result;
            line(out, "Failed stage", failed.getFailedStage());
            line(out, "Records inserted before failure", result.getRecordsInserted());
            line(out, "Error", failed.getErrorDetail());
        }
        return out.toString();
    }

    private static void line(StringBuilder out, String label, Object value) {
        out.append(label).append(": ").append(value).append(System.lineSeparator());
    }

    private static String describe(DescriptiveStats stats) {
        return String.format(Locale.ROOT, "n=%d mean=%.3f min=%.3f max=%.3f stddev=%s",
                stats.getCount(), stats.getMean(), stats.getMin(), stats.getMax(),
                stats.getStddev() != null ? String.format(Locale.ROOT, "%.3f", stats.getStddev()) : "n/a");
    }
}
