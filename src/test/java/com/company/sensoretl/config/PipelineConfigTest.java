package com.company.sensoretl.config;

import com.company.sensoretl.domain.SignalCatalog;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();

    @Test
    void signalCatalog_shouldBuildFromDefaults() {
        SignalCatalog catalog = config.signalCatalog(new EtlProperties());

        assertEquals(8, catalog.allSignals().size());
    }

    @Test
    void signalCatalog_shouldRejectMetricNotServedBySource() {
        EtlProperties properties = new EtlProperties();
        properties.getAggregation().setMetrics(List.of("wind_speed", "rotor_rpm"));

        assertThrows(IllegalArgumentException.class, () -> config.signalCatalog(properties));
    }

    @Test
    void validateBucketWidth_shouldAcceptWidthsThatTileADay() {
        assertDoesNotThrow(() -> PipelineConfig.validateBucketWidth(Duration.ofMinutes(10)));
        assertDoesNotThrow(() -> PipelineConfig.validateBucketWidth(Duration.ofMinutes(1)));
        assertDoesNotThrow(() -> PipelineConfig.validateBucketWidth(Duration.ofHours(1)));
    }

    @Test
    void validateBucketWidth_shouldRejectInvalidWidths() {
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.validateBucketWidth(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.validateBucketWidth(Duration.ofMinutes(-5)));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.validateBucketWidth(Duration.ofMinutes(7)));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.validateBucketWidth(Duration.ofNanos(500)));
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.validateBucketWidth(Duration.ofMillis(1).plusNanos(500_000)));
    }
}
