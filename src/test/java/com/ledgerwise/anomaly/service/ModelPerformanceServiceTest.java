package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.DetectorOutcome;
import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelPerformanceServiceTest {

    private final ModelPerformanceService performanceService =
            new ModelPerformanceService(new DetectionThresholdConfig());

    private static DetectorOutcome outcome(AlgorithmType type, double weight, int found, boolean succeeded) {
        List<DetectedAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < found; i++) {
            anomalies.add(TestDataFactory.anomaly("amount", Severity.MEDIUM, 2.5, (long) i));
        }
        return DetectorOutcome.builder()
                .algorithm(TestDataFactory.algorithm(type, weight))
                .anomalies(anomalies)
                .durationMs(12)
                .succeeded(succeeded)
                .build();
    }

    @Test
    void evaluate_reportsWeightsContributionsAndAgreement() {
        DetectedAnomaly agreed = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);
        agreed.getDetectedBy().add(AlgorithmType.ML_ISOLATION_FOREST);
        DetectedAnomaly single = TestDataFactory.anomaly("amount", Severity.MEDIUM, 2.6, 2L);

        ModelPerformance performance = performanceService.evaluate(List.of(
                        outcome(AlgorithmType.STATISTICAL, 3.0, 2, true),
                        outcome(AlgorithmType.ML_ISOLATION_FOREST, 1.0, 1, true)),
                List.of(agreed, single), true);

        assertThat(performance.getAlgorithms()).hasSize(2);
        AlgorithmPerformance statistical = performance.getAlgorithms().get(0);
        assertThat(statistical.getAlgorithm()).isEqualTo(AlgorithmType.STATISTICAL);
        assertThat(statistical.getContribution()).isCloseTo(0.75, within(1e-9));
        assertThat(statistical.getAnomaliesFound()).isEqualTo(2);
        assertThat(statistical.getProcessingTimeMs()).isEqualTo(12);
        assertThat(performance.getAgreementRate()).isCloseTo(0.5, within(1e-9));
        assertThat(performance.getModelVersion()).isEqualTo("1.0.0");
    }

    @Test
    void evaluate_withoutEnsemble_agreementIsZero() {
        ModelPerformance performance = performanceService.evaluate(
                List.of(outcome(AlgorithmType.STATISTICAL, 1.0, 1, true)),
                List.of(TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L)), false);

        assertThat(performance.isEnsembleApplied()).isFalse();
        assertThat(performance.getAgreementRate()).isZero();
        assertThat(performance.getAlgorithms().get(0).getContribution()).isEqualTo(1.0);
    }

    @Test
    void evaluate_zeroWeights_splitEvenly() {
        ModelPerformance performance = performanceService.evaluate(List.of(
                outcome(AlgorithmType.STATISTICAL, 0.0, 0, true),
                outcome(AlgorithmType.ML_ONE_CLASS_SVM, 0.0, 0, false)), List.of(), true);

        assertThat(performance.getAlgorithms()).extracting(AlgorithmPerformance::getContribution)
                .containsExactly(0.5, 0.5);
        assertThat(performance.getAlgorithms().get(1).isSucceeded()).isFalse();
    }
}
