package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.BusinessImpact;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionContext;
import com.ledgerwise.anomaly.model.ImpactCategory;
import com.ledgerwise.anomaly.model.ImpactLevel;
import com.ledgerwise.anomaly.model.Urgency;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies an anomaly's business impact from the names of its affected fields.
 * Compliance keywords take precedence over financial ones.
 */
@Component
public class BusinessImpactAssessor {

    private static final List<String> COMPLIANCE_KEYWORDS =
            List.of("compliance", "regulatory", "audit", "penalty");

    private static final List<String> FINANCIAL_KEYWORDS =
            List.of("revenue", "cost", "amount", "price", "fee", "payment", "balance", "invoice", "expense");

    public BusinessImpact assess(DetectedAnomaly anomaly, DetectionContext context) {
        boolean compliance = false;
        boolean financial = false;
        double potentialLoss = 0.0;

        for (AffectedField field : anomaly.getAffectedFields()) {
            String name = field.getFieldName() == null ? "" : field.getFieldName().toLowerCase(Locale.ROOT);
            if (matchesAny(name, COMPLIANCE_KEYWORDS)) {
                compliance = true;
            }
            if (matchesAny(name, FINANCIAL_KEYWORDS)) {
                financial = true;
                potentialLoss += Math.abs(field.getActualValue() - field.getExpectedValue());
            }
        }

        List<String> stakeholders = new ArrayList<>();
        if (context != null && context.getUserRole() != null) {
            stakeholders.add(context.getUserRole().name());
        }

        if (compliance) {
            return BusinessImpact.builder()
                    .category(ImpactCategory.COMPLIANCE)
                    .estimatedImpact(ImpactLevel.MAJOR)
                    .urgency(Urgency.IMMEDIATE)
                    .affectedProcesses(new ArrayList<>(List.of("Regulatory reporting", "Audit trail")))
                    .stakeholders(stakeholders)
                    .build();
        }
        if (financial) {
            return BusinessImpact.builder()
                    .category(ImpactCategory.FINANCIAL)
                    .estimatedImpact(ImpactLevel.MODERATE)
                    .urgency(Urgency.URGENT)
                    .potentialLoss(potentialLoss)
                    .affectedProcesses(new ArrayList<>(List.of("Financial reporting", "Reconciliation")))
                    .stakeholders(stakeholders)
                    .build();
        }
        return BusinessImpact.builder()
                .category(ImpactCategory.OPERATIONAL)
                .estimatedImpact(ImpactLevel.MINOR)
                .urgency(Urgency.STANDARD)
                .affectedProcesses(new ArrayList<>(List.of("Data processing", "Reporting")))
                .stakeholders(stakeholders)
                .build();
    }

    private static boolean matchesAny(String fieldName, List<String> keywords) {
        for (String keyword : keywords) {
            if (fieldName.contains(keyword)) return true;
        }
        return false;
    }
}
