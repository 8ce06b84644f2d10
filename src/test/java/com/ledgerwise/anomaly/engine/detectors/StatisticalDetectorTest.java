package com.ledgerwise.anomaly.engine.detectors;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.DetectorContext;
import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.service.DataPreparationService;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ledgerwise.anomaly.testutil.TestDataFactory.BASE_TIME;
import static com.ledgerwise.anomaly.testutil.TestDataFactory.HOUR_MS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticalDetectorTest {

    private StatisticalDetector detector;
    private DataPreparationService preparationService;
    private DetectorContext context;

    @BeforeEach
    void setUp() {
        detector = new StatisticalDetector(new DetectionThresholdConfig());
        preparationService = new DataPreparationService();
        context = DetectorContext.builder()
                .batchId("req-1")
                .algorithm(TestDataFactory.algorithm(AlgorithmType.STATISTICAL, 1.0))
                .build();
    }

    private PreparedBatch batchOf(double... amounts) {
        List<Object> data = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            data.add(TestDataFactory.record(BASE_TIME + i * HOUR_MS, "amount", amounts[i], "department", "tax"));
        }
        return preparationService.prepare(data, TestDataFactory.metadata("amount"));
    }

    @Test
    void detect_extremeValue_isCriticalWithCappedConfidence() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 10));
        PreparedBatch batch = batchOf(100, 101, 200);

        List<DetectedAnomaly> anomalies = detector.detect(batch, baseline,
                TestDataFactory.detectionConfig(Sensitivity.MEDIUM, AlgorithmType.STATISTICAL), context);

        assertThat(anomalies).hasSize(1);
        DetectedAnomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.POINT);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getConfidence()).isEqualTo(0.95);
        assertThat(anomaly.getAnomalyScore()).isCloseTo(10.0, within(1e-9));
        assertThat(anomaly.getRecordIndex()).isEqualTo(2);
        assertThat(anomaly.getTimestamp()).isEqualTo(BASE_TIME + 2 * HOUR_MS);
        assertThat(anomaly.getDetectedBy()).containsExactly(AlgorithmType.STATISTICAL);
        assertThat(anomaly.getAffectedFields()).singleElement().satisfies(f -> {
            assertThat(f.getFieldName()).isEqualTo("amount");
            assertThat(f.getExpectedValue()).isEqualTo(100.0);
            assertThat(f.getActualValue()).isEqualTo(200.0);
            assertThat(f.getContributionToAnomaly()).isEqualTo(1.0);
        });
        assertThat(anomaly.getExplanation().getStatisticalEvidence().getZScore()).isCloseTo(10.0, within(1e-9));
        assertThat(anomaly.getExplanation().getStatisticalEvidence().getPercentile()).isEqualTo(100.0);
        assertThat(anomaly.getContext().getRelatedEntities()).containsExactly("department=tax");
        assertThat(anomaly.getContext().getSurroundingData()).hasSize(2);
    }

    @Test
    void detect_borderlineValue_isLowSeverity() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 10));

        // z = 2.7, threshold 2.5: ratio 1.08
        List<DetectedAnomaly> anomalies = detector.detect(batchOf(127), baseline,
                TestDataFactory.detectionConfig(Sensitivity.MEDIUM, AlgorithmType.STATISTICAL), context);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.LOW);
        assertThat(anomalies.get(0).getConfidence()).isCloseTo(1.08 * 0.8, within(1e-9));
    }

    @Test
    void detect_negativeDeviation_isFlaggedBelowRange() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 10));

        List<DetectedAnomaly> anomalies = detector.detect(batchOf(60), baseline,
                TestDataFactory.detectionConfig(Sensitivity.MEDIUM, AlgorithmType.STATISTICAL), context);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getAffectedFields().get(0).getDeviationScore()).isCloseTo(-4.0, within(1e-9));
        assertThat(anomalies.get(0).getExplanation().getPrimaryCause()).contains("below");
    }

    @Test
    void detect_sensitivityChangesThreshold() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 10));
        PreparedBatch batch = batchOf(127);

        assertThat(detector.detect(batch, baseline,
                TestDataFactory.detectionConfig(Sensitivity.LOW, AlgorithmType.STATISTICAL), context)).isEmpty();
        assertThat(detector.detect(batch, baseline,
                TestDataFactory.detectionConfig(Sensitivity.HIGH, AlgorithmType.STATISTICAL), context)).hasSize(1);
    }

    @Test
    void detect_customThresholdOverridesSensitivity() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 10));
        DetectionConfiguration config = TestDataFactory.detectionConfig(Sensitivity.CUSTOM, AlgorithmType.STATISTICAL);
        config.setCustomThresholds(CustomThresholds.builder().statisticalThreshold(5.0).build());

        assertThat(detector.detect(batchOf(140), baseline, config, context)).isEmpty();
        assertThat(detector.detect(batchOf(160), baseline, config, context)).hasSize(1);
    }

    @Test
    void detect_zeroStdField_neverFlags() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 0));

        List<DetectedAnomaly> anomalies = detector.detect(batchOf(100, 1_000_000), baseline,
                TestDataFactory.detectionConfig(Sensitivity.HIGH, AlgorithmType.STATISTICAL), context);

        assertThat(anomalies).isEmpty();
    }

    @Test
    void detect_seasonalityAware_reportsPatternStrength() {
        HistoricalBaseline baseline = TestDataFactory.baseline(50, TestDataFactory.metric("amount", 100, 10));
        baseline.getPatterns().add(BaselinePattern.builder()
                .pattern("amount:hour_of_day").frequency(24).strength(0.7).build());
        DetectionConfiguration config = TestDataFactory.detectionConfig(Sensitivity.MEDIUM, AlgorithmType.STATISTICAL);
        config.setSeasonalityAware(true);

        List<DetectedAnomaly> anomalies = detector.detect(batchOf(200), baseline, config, context);

        assertThat(anomalies.get(0).getExplanation().getPatternAnalysis().getSeasonalityImpact()).isEqualTo(0.7);
    }
}
