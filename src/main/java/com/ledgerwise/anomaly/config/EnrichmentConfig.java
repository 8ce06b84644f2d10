package com.ledgerwise.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection.enrichment")
public class EnrichmentConfig {

    // Off by default: anomalies carry only their statistical explanation
    private boolean enabled = false;

    private String url = "http://localhost:8090/api/v1/generate";

    private String apiKey;

    // Applied when the request context carries no timeout of its own
    private Duration defaultTimeout = Duration.ofSeconds(5);

    private Duration connectTimeout = Duration.ofSeconds(2);

    private int maxEnrichedAnomalies = 20;

    private int maxListItems = 3;
}
