package com.company.sensoretl.config;

import com.company.sensoretl.domain.SignalCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
@EnableConfigurationProperties(EtlProperties.class)
public class PipelineConfig {

    /**
     * Signal set derived from the configured metrics. Startup fails on a metric outside the source
     * allow-list or a bucket width that does not tile a day.
     */
    @Bean
    public SignalCatalog signalCatalog(EtlProperties properties) {
        validateBucketWidth(properties.getAggregation().getBucketWidth());

        SignalCatalog catalog = SignalCatalog.of(
                properties.getAggregation().getMetrics(),
                properties.getSource().getAllowedVariables());

        log.info("Signal catalog: {} metrics, {} signals, bucket width {}",
                catalog.getMetrics().size(), catalog.allSignals().size(),
                properties.getAggregation().getBucketWidth());
        return catalog;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static void validateBucketWidth(Duration width) {
        if (width == null || width.toMillis() < 1) {
            throw new IllegalArgumentException("Bucket width must be at least one millisecond: " + width);
        }
        if (width.getNano() % 1_000_000 != 0 || Duration.ofDays(1).toMillis() % width.toMillis() != 0) {
            throw new IllegalArgumentException("Bucket width must divide one day evenly: " + width);
        }
    }
}
