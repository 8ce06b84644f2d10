package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationServiceTest {

    private final RecommendationService recommendationService =
            new RecommendationService(new DetectionThresholdConfig());

    private static DetectedAnomaly withImpact(String field, Severity severity, ImpactCategory category) {
        DetectedAnomaly anomaly = TestDataFactory.anomaly(field, severity, 3.0, 1L);
        anomaly.setBusinessImpact(BusinessImpact.builder().category(category).build());
        return anomaly;
    }

    @Test
    void insufficientData_onlyAsksForMoreData() {
        List<DetectionRecommendation> recommendations =
                recommendationService.recommend(List.of(), DetectionStatus.INSUFFICIENT_DATA, 4, 10);

        assertThat(recommendations).hasSize(1);
        DetectionRecommendation recommendation = recommendations.get(0);
        assertThat(recommendation.getType()).isEqualTo(RecommendationType.MONITORING_ENHANCEMENT);
        assertThat(recommendation.getDescription()).contains("Only 4 usable records").contains("at least 10");
    }

    @Test
    void noAnomalies_noRecommendations() {
        assertThat(recommendationService.recommend(List.of(), DetectionStatus.COMPLETED, 50, 10)).isEmpty();
    }

    @Test
    void criticalAnomalies_immediateActionReferencingThem() {
        DetectedAnomaly critical = TestDataFactory.anomaly("headcount", Severity.CRITICAL, 9.0, 1L);
        DetectedAnomaly low = TestDataFactory.anomaly("headcount", Severity.LOW, 2.0, 2L);

        List<DetectionRecommendation> recommendations =
                recommendationService.recommend(List.of(critical, low), DetectionStatus.COMPLETED, 50, 10);

        assertThat(recommendations).hasSize(1);
        assertThat(recommendations.get(0).getType()).isEqualTo(RecommendationType.IMMEDIATE_ACTION);
        assertThat(recommendations.get(0).getPriority()).isEqualTo(RecommendationPriority.HIGH);
        assertThat(recommendations.get(0).getRelatedAnomalyIds()).containsExactly(critical.getId());
    }

    @Test
    void manyAnomalies_processImprovement() {
        List<DetectedAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            anomalies.add(TestDataFactory.anomaly("headcount", Severity.MEDIUM, 2.5, (long) i));
        }

        List<DetectionRecommendation> recommendations =
                recommendationService.recommend(anomalies, DetectionStatus.COMPLETED, 50, 10);

        assertThat(recommendations).extracting(DetectionRecommendation::getType)
                .containsExactly(RecommendationType.PROCESS_IMPROVEMENT);
        assertThat(recommendations.get(0).getDescription()).startsWith("11 anomalies");
    }

    @Test
    void financialAndComplianceImpact_investigations() {
        DetectedAnomaly financial = withImpact("amount", Severity.MEDIUM, ImpactCategory.FINANCIAL);
        DetectedAnomaly compliance = withImpact("audit_flags", Severity.MEDIUM, ImpactCategory.COMPLIANCE);
        DetectedAnomaly operational = withImpact("latency", Severity.MEDIUM, ImpactCategory.OPERATIONAL);

        List<DetectionRecommendation> recommendations = recommendationService.recommend(
                List.of(financial, compliance, operational), DetectionStatus.COMPLETED, 50, 10);

        assertThat(recommendations).extracting(DetectionRecommendation::getTitle)
                .containsExactly("Financial Data Investigation", "Compliance Review");
        assertThat(recommendations.get(0).getRelatedAnomalyIds()).containsExactly(financial.getId());
        assertThat(recommendations.get(1).getRelatedAnomalyIds()).containsExactly(compliance.getId());
    }
}
