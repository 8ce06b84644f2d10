package com.ledgerwise.anomaly.engine.detectors;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.DetectorContext;
import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.service.BaselineService;
import com.ledgerwise.anomaly.service.DataPreparationService;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OneClassBoundaryDetectorTest {

    private OneClassBoundaryDetector detector;
    private DataPreparationService preparationService;
    private BaselineService baselineService;
    private DetectorContext context;

    @BeforeEach
    void setUp() {
        DetectionThresholdConfig config = new DetectionThresholdConfig();
        detector = new OneClassBoundaryDetector(config);
        preparationService = new DataPreparationService();
        baselineService = new BaselineService(preparationService, config);
        context = DetectorContext.builder()
                .batchId("req-oc")
                .algorithm(TestDataFactory.algorithm(AlgorithmType.ML_ONE_CLASS_SVM, 1.0))
                .build();
    }

    @Test
    void detect_flagsOnlyPointsOutsideTheBoundary() {
        PreparedBatch batch = preparationService.prepare(
                IsolationForestDetectorTest.clusterWithOutlier(), TestDataFactory.metadata("amount", "fee"));
        HistoricalBaseline baseline = baselineService.buildBaseline(batch);

        List<DetectedAnomaly> anomalies = detector.detect(batch, baseline,
                TestDataFactory.detectionConfig(Sensitivity.MEDIUM, AlgorithmType.ML_ONE_CLASS_SVM), context);

        assertThat(anomalies).hasSize(1);
        DetectedAnomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getRecordIndex()).isEqualTo(40);
        assertThat(anomaly.getAnomalyScore()).isGreaterThan(1.0);
        assertThat(anomaly.getDetectedBy()).containsExactly(AlgorithmType.ML_ONE_CLASS_SVM);
        assertThat(anomaly.getAffectedFields().stream().mapToDouble(AffectedField::getContributionToAnomaly).sum())
                .isCloseTo(1.0, within(1e-9));
        assertThat(anomaly.getAffectedFields().get(0).getExpectedValue())
                .isEqualTo(baseline.getMetrics().get("amount").getMean());
    }

    @Test
    void detect_identicalRecords_flagNothing() {
        List<Object> data = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            data.add(TestDataFactory.record(TestDataFactory.BASE_TIME + i, "amount", 5.0));
        }
        PreparedBatch batch = preparationService.prepare(data, TestDataFactory.metadata("amount"));

        List<DetectedAnomaly> anomalies = detector.detect(batch, baselineService.buildBaseline(batch),
                TestDataFactory.detectionConfig(Sensitivity.MEDIUM, AlgorithmType.ML_ONE_CLASS_SVM), context);

        assertThat(anomalies).isEmpty();
    }
}
