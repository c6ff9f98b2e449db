package com.company.sensoretl.source;

import com.company.sensoretl.config.EtlProperties;
import com.company.sensoretl.domain.RawSample;
import com.company.sensoretl.dto.source.SourceDataResponse;
import com.company.sensoretl.exception.PartitionValidationException;
import com.company.sensoretl.exception.SourceUnavailableException;
import com.company.sensoretl.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link SourceReader} backed by the source HTTP API.
 */
@Component
@Slf4j
public class HttpSourceReader implements SourceReader {

    private static final String DATA_PATH = "/data?start={start}&end={end}&variables={variables}";
    private static final String TIMESTAMP_FIELD = "timestamp";

    private final RestTemplate restTemplate;
    private final List<String> allowedVariables;

    public HttpSourceReader(@Qualifier("sourceRestTemplate") RestTemplate restTemplate,
                            EtlProperties properties) {
        this.restTemplate = restTemplate;
        this.allowedVariables = List.copyOf(properties.getSource().getAllowedVariables());
    }

    @Override
    public List<RawSample> readSamples(Instant start, Instant end, List<String> metrics) {
        validateRequest(start, end, metrics);

        String variables = TIMESTAMP_FIELD + "," + String.join(",", metrics);
        log.info("Reading source window [{}, {}) for variables {}", start, end, metrics);

        SourceDataResponse response;
        try {
            response = restTemplate.getForObject(DATA_PATH, SourceDataResponse.class,
                    Map.of("start", start.toString(), "end", end.toString(), "variables", variables));
        } catch (ResourceAccessException e) {
            throw new SourceUnavailableException("Source API unreachable or timed out: " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw new SourceUnavailableException("Source API returned " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Source API call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getData() == null || response.getData().isEmpty()) {
            log.warn("Source returned no rows for [{}, {})", start, end);
            return List.of();
        }

        List<RawSample> samples = toSamples(response.getData(), start, end, metrics);
        log.info("Read {} source rows, {} samples", response.getData().size(), samples.size());
        return samples;
    }

    private void validateRequest(Instant start, Instant end, List<String> metrics) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new PartitionValidationException("Invalid source window [" + start + ", " + end + ")");
        }
        if (metrics == null || metrics.isEmpty()) {
            throw new PartitionValidationException("At least one metric must be requested");
        }
        List<String> unknown = metrics.stream()
                .filter(metric -> !allowedVariables.contains(metric) || TIMESTAMP_FIELD.equals(metric))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new PartitionValidationException(
                    "Unknown metrics " + unknown + "; allowed: " + allowedVariables);
        }
    }

    /**
     * Flattens wide source rows into samples. Null values are skipped; rows outside the half-open
     * window are dropped because the source treats the end bound as inclusive.
     */
    private List<RawSample> toSamples(List<Map<String, Object>> rows, Instant start, Instant end,
                                      List<String> metrics) {
        List<RawSample> samples = new ArrayList<>(rows.size() * metrics.size());
        for (Map<String, Object> row : rows) {
            Object rawTimestamp = row.get(TIMESTAMP_FIELD);
            if (rawTimestamp == null) {
                throw new SourceUnavailableException("Source row without timestamp: " + row);
            }
            Instant timestamp = TimeUtils.parseSourceTimestamp(rawTimestamp.toString());
            if (timestamp.isBefore(start) || !timestamp.isBefore(end)) {
                continue;
            }

            for (String metric : metrics) {
                Object value = row.get(metric);
                if (value == null) {
                    continue;
                }
                samples.add(new RawSample(timestamp, metric, toDouble(metric, value)));
            }
        }

        samples.sort(Comparator.comparing(RawSample::getTimestamp).thenComparing(RawSample::getMetric));
        return samples;
    }

    private double toDouble(String metric, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new SourceUnavailableException("Non-numeric value for " + metric + ": " + value, e);
        }
    }
}
