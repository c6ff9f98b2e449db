package com.company.sensoretl.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the source API. Both timeouts are bounded so a stalled source fails the partition.
 */
@Configuration
@RequiredArgsConstructor
public class SourceClientConfig {

    private final EtlProperties properties;

    @Bean
    public RestTemplate sourceRestTemplate(RestTemplateBuilder builder) {
        EtlProperties.Source source = properties.getSource();
        return builder
                .rootUri(source.getBaseUrl())
                .connectTimeout(source.getConnectTimeout())
                .readTimeout(source.getReadTimeout())
                .build();
    }
}
