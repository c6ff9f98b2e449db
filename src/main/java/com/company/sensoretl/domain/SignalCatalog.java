package com.company.sensoretl.domain;

import com.company.sensoretl.domain.enums.StatKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Closed set of signals derived from the configured metrics and every {@link StatKind}.
 * Built once when configuration loads; rejects metric names that could not form a valid signal name.
 */
public final class SignalCatalog {

    private static final Pattern METRIC_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final List<String> metrics;
    private final Map<String, Map<StatKind, SignalName>> signalsByMetric;

    private SignalCatalog(List<String> metrics, Map<String, Map<StatKind, SignalName>> signalsByMetric) {
        this.metrics = metrics;
        this.signalsByMetric = signalsByMetric;
    }

    public static SignalCatalog of(Collection<String> metrics, Collection<String> allowedVariables) {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("At least one metric must be configured");
        }

        Map<String, Map<StatKind, SignalName>> byMetric = new LinkedHashMap<>();
        for (String metric : metrics) {
            if (metric == null || !METRIC_NAME.matcher(metric).matches()) {
                throw new IllegalArgumentException("Invalid metric name: " + metric);
            }
            if (allowedVariables != null && !allowedVariables.contains(metric)) {
                throw new IllegalArgumentException(
                        "Metric " + metric + " is not in the source allow-list " + allowedVariables);
            }
            if (byMetric.containsKey(metric)) {
                throw new IllegalArgumentException("Duplicate metric: " + metric);
            }

            Map<StatKind, SignalName> signals = new EnumMap<>(StatKind.class);
            for (StatKind kind : StatKind.values()) {
                signals.put(kind, new SignalName(metric, kind));
            }
            byMetric.put(metric, Collections.unmodifiableMap(signals));
        }

        return new SignalCatalog(List.copyOf(byMetric.keySet()), Collections.unmodifiableMap(byMetric));
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public boolean containsMetric(String metric) {
        return signalsByMetric.containsKey(metric);
    }

    public SignalName signal(String metric, StatKind kind) {
        Map<StatKind, SignalName> signals = signalsByMetric.get(metric);
        if (signals == null) {
            throw new IllegalArgumentException("Metric not in catalog: " + metric);
        }
        return signals.get(kind);
    }

    public List<SignalName> allSignals() {
        List<SignalName> all = new ArrayList<>();
        signalsByMetric.values().forEach(signals -> all.addAll(signals.values()));
        return all;
    }
}
