package com.ledgerwise.anomaly;

import com.ledgerwise.anomaly.config.AlertPolicyConfig;
import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.config.EnrichmentConfig;
import com.ledgerwise.anomaly.config.TestAerospikeConfig;
import com.ledgerwise.anomaly.engine.DetectorRegistry;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.service.AnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class AnomalyDetectionApplicationTest {

    @Autowired
    private DetectorRegistry detectorRegistry;

    @Autowired
    private AnomalyDetectionService detectionService;

    @Autowired
    private DetectionThresholdConfig thresholdConfig;

    @Autowired
    private EnrichmentConfig enrichmentConfig;

    @Autowired
    private AlertPolicyConfig alertPolicyConfig;

    @Test
    void contextLoads_withAllDetectorsRegistered() {
        assertThat(detectorRegistry.getRegisteredAlgorithms()).containsExactlyInAnyOrder(
                AlgorithmType.STATISTICAL, AlgorithmType.ML_ISOLATION_FOREST, AlgorithmType.ML_ONE_CLASS_SVM);
        assertThat(detectionService.getDetectionCapabilities().getAlgorithms()).hasSize(3);
    }

    @Test
    void properties_boundFromYaml() {
        assertThat(thresholdConfig.getIsolation().getNumTrees()).isEqualTo(100);
        assertThat(thresholdConfig.getExecutor().getDetectionThreads()).isEqualTo(2);
        assertThat(enrichmentConfig.isEnabled()).isFalse();
        assertThat(alertPolicyConfig.isEnabled()).isFalse();
    }
}
