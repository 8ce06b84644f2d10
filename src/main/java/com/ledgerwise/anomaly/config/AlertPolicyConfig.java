package com.ledgerwise.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection.alerts")
public class AlertPolicyConfig {

    private boolean enabled = true;

    // How often pending alerts are dispatched and sent alerts checked for escalation
    private int checkIntervalSeconds = 60;

    // Resolved alerts older than this are dropped from memory
    private Duration resolvedRetention = Duration.ofDays(7);

    // Pending, sent or acknowledged alerts untouched for this long are dropped
    private Duration staleRetention = Duration.ofDays(30);
}
