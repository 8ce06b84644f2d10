package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionRecommendation;
import com.ledgerwise.anomaly.model.DetectionStatus;
import com.ledgerwise.anomaly.model.ImpactCategory;
import com.ledgerwise.anomaly.model.RecommendationPriority;
import com.ledgerwise.anomaly.model.RecommendationType;
import com.ledgerwise.anomaly.model.Severity;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

@Service
public class RecommendationService {

    private final DetectionThresholdConfig config;

    public RecommendationService(DetectionThresholdConfig config) {
        this.config = config;
    }

    public List<DetectionRecommendation> recommend(List<DetectedAnomaly> anomalies, DetectionStatus status,
                                                   int sampleCount, int minimumSamples) {
        List<DetectionRecommendation> recommendations = new ArrayList<>();

        if (status == DetectionStatus.INSUFFICIENT_DATA) {
            recommendations.add(DetectionRecommendation.builder()
                    .type(RecommendationType.MONITORING_ENHANCEMENT)
                    .priority(RecommendationPriority.MEDIUM)
                    .title("Collect More Baseline Data")
                    .description(String.format("Only %d usable records were available; at least %d are needed "
                            + "before anomalies can be scored", sampleCount, minimumSamples))
                    .actionSteps(new ArrayList<>(List.of(
                            "Extend the time range of the submitted data",
                            "Check upstream collection for gaps",
                            "Re-run detection once enough history exists")))
                    .expectedOutcome("Reliable baseline for anomaly scoring")
                    .resources(new ArrayList<>(List.of("Data engineer")))
                    .timeline("Before the next detection run")
                    .successCriteria(new ArrayList<>(List.of("Sample count meets the configured minimum")))
                    .build());
            return recommendations;
        }

        List<String> critical = idsWhere(anomalies, a -> a.getSeverity() == Severity.CRITICAL);
        if (!critical.isEmpty()) {
            recommendations.add(DetectionRecommendation.builder()
                    .type(RecommendationType.IMMEDIATE_ACTION)
                    .priority(RecommendationPriority.HIGH)
                    .title("Address Critical Anomalies")
                    .description(critical.size() + " critical anomalies detected requiring immediate attention")
                    .actionSteps(new ArrayList<>(List.of(
                            "Review critical anomaly details",
                            "Verify data accuracy",
                            "Check system integrity",
                            "Implement corrective measures",
                            "Monitor for recurrence")))
                    .expectedOutcome("Resolution of critical issues and prevention of business impact")
                    .resources(new ArrayList<>(List.of("Data analyst", "System administrator", "Business stakeholder")))
                    .timeline("Immediate (within 1 hour)")
                    .successCriteria(new ArrayList<>(List.of(
                            "All critical anomalies resolved", "Root cause identified", "Prevention measures in place")))
                    .relatedAnomalyIds(critical)
                    .build());
        }

        if (anomalies.size() > config.getRecommendationAnomalyThreshold()) {
            recommendations.add(DetectionRecommendation.builder()
                    .type(RecommendationType.PROCESS_IMPROVEMENT)
                    .priority(RecommendationPriority.MEDIUM)
                    .title("Investigate Systematic Issues")
                    .description(anomalies.size() + " anomalies in one run suggests a systematic problem")
                    .actionSteps(new ArrayList<>(List.of(
                            "Analyze anomaly patterns",
                            "Review data collection processes",
                            "Validate system configurations",
                            "Consider baseline updates")))
                    .expectedOutcome("Improved data quality and reduced false positives")
                    .resources(new ArrayList<>(List.of("Process analyst", "Quality assurance team")))
                    .timeline("1-2 weeks")
                    .successCriteria(new ArrayList<>(List.of(
                            "Anomaly rate reduced by 50%", "Process improvements documented")))
                    .build());
        }

        List<String> financial = idsWhere(anomalies, a -> a.getBusinessImpact() != null
                && a.getBusinessImpact().getCategory() == ImpactCategory.FINANCIAL);
        if (!financial.isEmpty()) {
            recommendations.add(DetectionRecommendation.builder()
                    .type(RecommendationType.INVESTIGATION)
                    .priority(RecommendationPriority.HIGH)
                    .title("Financial Data Investigation")
                    .description(financial.size() + " financial anomalies require investigation")
                    .actionSteps(new ArrayList<>(List.of(
                            "Review financial transactions",
                            "Verify account balances",
                            "Check for data entry errors",
                            "Validate calculation logic")))
                    .expectedOutcome("Accurate financial reporting")
                    .resources(new ArrayList<>(List.of("Financial analyst", "Accounting team")))
                    .timeline("2-3 days")
                    .successCriteria(new ArrayList<>(List.of(
                            "Financial accuracy verified", "Discrepancies resolved")))
                    .relatedAnomalyIds(financial)
                    .build());
        }

        List<String> compliance = idsWhere(anomalies, a -> a.getBusinessImpact() != null
                && a.getBusinessImpact().getCategory() == ImpactCategory.COMPLIANCE);
        if (!compliance.isEmpty()) {
            recommendations.add(DetectionRecommendation.builder()
                    .type(RecommendationType.INVESTIGATION)
                    .priority(RecommendationPriority.HIGH)
                    .title("Compliance Review")
                    .description(compliance.size() + " anomalies touch compliance-relevant fields")
                    .actionSteps(new ArrayList<>(List.of(
                            "Confirm the affected filings and deadlines",
                            "Document findings for the audit trail",
                            "Escalate to the compliance owner")))
                    .expectedOutcome("No regulatory exposure from the flagged records")
                    .resources(new ArrayList<>(List.of("Compliance officer", "Audit team")))
                    .timeline("Within 1 business day")
                    .successCriteria(new ArrayList<>(List.of(
                            "Each anomaly reviewed and signed off", "Remediation recorded")))
                    .relatedAnomalyIds(compliance)
                    .build());
        }

        return recommendations;
    }

    private static List<String> idsWhere(List<DetectedAnomaly> anomalies, Predicate<DetectedAnomaly> filter) {
        return new ArrayList<>(anomalies.stream().filter(filter).map(DetectedAnomaly::getId).toList());
    }
}
