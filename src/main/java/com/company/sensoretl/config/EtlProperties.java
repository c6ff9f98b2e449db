package com.company.sensoretl.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline configuration bound from {@code sensor-etl.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sensor-etl")
public class EtlProperties {

    @Valid
    private Source source = new Source();

    @Valid
    private Aggregation aggregation = new Aggregation();

    @Valid
    private Load load = new Load();

    private Registry registry = new Registry();

    @Valid
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Source {
        @NotBlank
        private String baseUrl = "http://localhost:8000";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        @NotEmpty
        private List<String> allowedVariables = new ArrayList<>(
                List.of("wind_speed", "power", "ambient_temprature"));
    }

    @Data
    public static class Aggregation {
        @NotNull
        private Duration bucketWidth = Duration.ofMinutes(10);
        @NotEmpty
        private List<String> metrics = new ArrayList<>(List.of("wind_speed", "power"));
    }

    @Data
    public static class Load {
        @Min(1)
        private int batchSize = 1000;
    }

    @Data
    public static class Registry {
        // false reuses the snapshot until refreshRegistry() is called
        private boolean refreshPerRun = true;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        @Min(1)
        private int catchUpDays = 1;
        @Valid
        private Backfill backfill = new Backfill();
    }

    @Data
    public static class Backfill {
        private LocalDate startDate;
        private LocalDate endDate;
        @Min(1)
        private int maxPartitionsPerTick = 1;

        public boolean isConfigured() {
            return startDate != null && endDate != null && !endDate.isBefore(startDate);
        }
    }
}
