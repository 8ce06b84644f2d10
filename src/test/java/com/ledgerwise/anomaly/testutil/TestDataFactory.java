package com.ledgerwise.anomaly.testutil;

import com.ledgerwise.anomaly.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    // 2024-01-01T00:00:00Z, a Monday
    public static final long BASE_TIME = 1704067200000L;
    public static final long HOUR_MS = 3_600_000L;

    private TestDataFactory() {}

    public static Map<String, Object> record(long timestamp, Object... fieldValuePairs) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", timestamp);
        for (int i = 0; i + 1 < fieldValuePairs.length; i += 2) {
            record.put((String) fieldValuePairs[i], fieldValuePairs[i + 1]);
        }
        return record;
    }

    public static DataSourceMetadata metadata(String... valueFields) {
        return DataSourceMetadata.builder()
                .timestampField("timestamp")
                .valueFields(new ArrayList<>(List.of(valueFields)))
                .categoricalFields(new ArrayList<>(List.of("department")))
                .expectedFrequency(ExpectedFrequency.HOURLY)
                .build();
    }

    /**
     * Hourly records for one field cycling through base-2, base-1, base, base+1, base+2.
     * Mean is base and population std is sqrt(2) for any multiple of five records.
     */
    public static List<Object> steadySeries(String field, double base, int count) {
        List<Object> data = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            data.add(record(BASE_TIME + i * HOUR_MS, field, base + (i % 5) - 2, "department", "audit"));
        }
        return data;
    }

    public static DataSource dataSource(List<Object> data, String... valueFields) {
        return DataSource.builder()
                .type(DataSourceType.FINANCIAL_TRANSACTIONS)
                .sourceId("ledger-main")
                .data(data)
                .metadata(metadata(valueFields))
                .build();
    }

    public static AnomalyAlgorithm algorithm(AlgorithmType type, double weight) {
        return AnomalyAlgorithm.builder().type(type).weight(weight).build();
    }

    public static DetectionConfiguration detectionConfig(Sensitivity sensitivity, AlgorithmType... types) {
        List<AnomalyAlgorithm> algorithms = new ArrayList<>();
        for (AlgorithmType type : types) {
            algorithms.add(algorithm(type, 1.0));
        }
        return DetectionConfiguration.builder()
                .algorithms(algorithms)
                .sensitivity(sensitivity)
                .build();
    }

    /**
     * Every severity tier alerts from a score of zero; no suppression, escalation or business hours.
     */
    public static AlertConfiguration permissiveAlertConfig() {
        return AlertConfiguration.builder()
                .severity(SeverityConfiguration.builder()
                        .critical(SeverityThreshold.builder().threshold(0.0).build())
                        .high(SeverityThreshold.builder().threshold(0.0).build())
                        .medium(SeverityThreshold.builder().threshold(0.0).build())
                        .low(SeverityThreshold.builder().threshold(0.0).build())
                        .build())
                .channels(new ArrayList<>(List.of(AlertChannel.builder()
                        .type(AlertChannelType.EMAIL)
                        .recipients(new ArrayList<>(List.of("controller@example.com")))
                        .build())))
                .build();
    }

    public static DetectionContext detectionContext(UserRole role) {
        return DetectionContext.builder()
                .userRole(role)
                .businessUnit("finance")
                .build();
    }

    public static AnomalyDetectionRequest request(DataSource dataSource, DetectionConfiguration config) {
        return AnomalyDetectionRequest.builder()
                .organizationId("org-1")
                .userId("user-1")
                .dataSource(dataSource)
                .detectionConfig(config)
                .alertConfig(permissiveAlertConfig())
                .context(detectionContext(UserRole.MANAGER))
                .build();
    }

    public static DetectedAnomaly anomaly(String field, Severity severity, double score, Long timestamp) {
        return DetectedAnomaly.builder()
                .id(UUID.randomUUID().toString())
                .type(AnomalyType.POINT)
                .severity(severity)
                .confidence(0.6)
                .anomalyScore(score)
                .timestamp(timestamp)
                .detectedBy(new ArrayList<>(List.of(AlgorithmType.STATISTICAL)))
                .affectedFields(new ArrayList<>(List.of(AffectedField.builder()
                        .fieldName(field)
                        .expectedValue(100.0)
                        .actualValue(160.0)
                        .deviationScore(score)
                        .contributionToAnomaly(1.0)
                        .build())))
                .explanation(AnomalyExplanation.builder()
                        .primaryCause(field + " far from baseline")
                        .contributingFactors(new ArrayList<>(List.of("Z-score above threshold")))
                        .build())
                .build();
    }

    public static BaselineMetric metric(String field, double mean, double std) {
        return BaselineMetric.builder()
                .field(field)
                .mean(mean)
                .std(std)
                .min(mean - 3 * std)
                .max(mean + 3 * std)
                .build();
    }

    public static HistoricalBaseline baseline(int sampleCount, BaselineMetric... metrics) {
        Map<String, BaselineMetric> byField = new LinkedHashMap<>();
        for (BaselineMetric metric : metrics) {
            byField.put(metric.getField(), metric);
        }
        return HistoricalBaseline.builder()
                .metrics(byField)
                .sampleCount(sampleCount)
                .lastUpdated(System.currentTimeMillis())
                .build();
    }
}
