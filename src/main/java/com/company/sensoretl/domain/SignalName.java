package com.company.sensoretl.domain;

import com.company.sensoretl.domain.enums.StatKind;
import lombok.Value;

/**
 * A derived signal: one statistic of one metric, rendered as {@code metric_stat}.
 * The pipeline obtains instances from {@link SignalCatalog} rather than building names from strings.
 */
@Value
public class SignalName {
    String metric;
    StatKind statKind;

    public String asString() {
        return metric + "_" + statKind.getSuffix();
    }

    @Override
    public String toString() {
        return asString();
    }
}
