package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-severity alert thresholds. A missing tier means anomalies of that severity never alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeverityConfiguration {

    private SeverityThreshold critical;
    private SeverityThreshold high;
    private SeverityThreshold medium;
    private SeverityThreshold low;

    public SeverityThreshold forSeverity(Severity severity) {
        if (severity == null) return null;
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }
}
