package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.AnomalyExplanation;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Merges anomalies that several algorithms found on the same record and fields.
 *
 * Anomalies are grouped by (timestamp, or record index when the record has none) plus the
 * sorted affected-field names. Groups keep the order in which they were first seen.
 * A merged anomaly takes the highest score, the most severe severity and a boosted
 * confidence that is never below the best input and never above 0.95.
 */
@Component
public class EnsembleCombiner {

    private final DetectionThresholdConfig thresholdConfig;

    public EnsembleCombiner(DetectionThresholdConfig thresholdConfig) {
        this.thresholdConfig = thresholdConfig;
    }

    public List<DetectedAnomaly> combine(List<DetectorOutcome> outcomes) {
        Map<String, List<Weighted>> groups = new LinkedHashMap<>();
        for (DetectorOutcome outcome : outcomes) {
            double weight = outcome.getAlgorithm() == null ? 1.0 : outcome.getAlgorithm().getWeight();
            for (DetectedAnomaly anomaly : outcome.getAnomalies()) {
                groups.computeIfAbsent(groupKey(anomaly), k -> new ArrayList<>())
                        .add(new Weighted(anomaly, weight));
            }
        }

        List<DetectedAnomaly> combined = new ArrayList<>(groups.size());
        for (List<Weighted> group : groups.values()) {
            combined.add(group.size() == 1 ? group.get(0).anomaly() : merge(group));
        }
        return combined;
    }

    /**
     * Flatten outcomes without merging, for single-algorithm runs.
     */
    public static List<DetectedAnomaly> flatten(List<DetectorOutcome> outcomes) {
        List<DetectedAnomaly> all = new ArrayList<>();
        for (DetectorOutcome outcome : outcomes) {
            all.addAll(outcome.getAnomalies());
        }
        return all;
    }

    static String groupKey(DetectedAnomaly anomaly) {
        String position = anomaly.getTimestamp() != null
                ? String.valueOf(anomaly.getTimestamp())
                : "#" + anomaly.getRecordIndex();
        String fields = anomaly.getAffectedFields().stream()
                .map(AffectedField::getFieldName)
                .sorted()
                .collect(Collectors.joining(","));
        return position + "|" + fields;
    }

    private DetectedAnomaly merge(List<Weighted> group) {
        DetectedAnomaly lead = group.stream()
                .map(Weighted::anomaly)
                .max(Comparator.comparingDouble(DetectedAnomaly::getAnomalyScore))
                .orElseThrow();

        double sumConfidence = 0.0;
        double maxConfidence = 0.0;
        double maxScore = 0.0;
        Severity severity = null;
        Set<AlgorithmType> detectedBy = new LinkedHashSet<>();
        for (Weighted w : group) {
            DetectedAnomaly a = w.anomaly();
            sumConfidence += a.getConfidence();
            maxConfidence = Math.max(maxConfidence, a.getConfidence());
            maxScore = Math.max(maxScore, a.getAnomalyScore());
            if (a.getSeverity() != null && a.getSeverity().isMoreSevereThan(severity)) {
                severity = a.getSeverity();
            }
            detectedBy.addAll(a.getDetectedBy());
        }
        double boosted = sumConfidence / group.size() + thresholdConfig.getEnsembleBoost();
        double confidence = Math.min(DetectedAnomaly.MAX_CONFIDENCE, Math.max(boosted, maxConfidence));

        return DetectedAnomaly.builder()
                .id(UUID.randomUUID().toString())
                .type(lead.getType())
                .severity(severity)
                .confidence(confidence)
                .anomalyScore(maxScore)
                .timestamp(lead.getTimestamp())
                .recordIndex(lead.getRecordIndex())
                .detectedBy(new ArrayList<>(detectedBy))
                .affectedFields(mergeFields(group))
                .context(lead.getContext())
                .explanation(mergeExplanations(group, lead, detectedBy.size()))
                .build();
    }

    private List<AffectedField> mergeFields(List<Weighted> group) {
        double totalWeight = group.stream().mapToDouble(w -> Math.max(0.0, w.weight())).sum();
        boolean equalWeights = totalWeight <= 0;

        Map<String, AffectedField> merged = new LinkedHashMap<>();
        for (Weighted w : group) {
            double share = equalWeights ? 1.0 / group.size() : Math.max(0.0, w.weight()) / totalWeight;
            for (AffectedField field : w.anomaly().getAffectedFields()) {
                AffectedField target = merged.computeIfAbsent(field.getFieldName(), name -> AffectedField.builder()
                        .fieldName(name)
                        .expectedValue(field.getExpectedValue())
                        .actualValue(field.getActualValue())
                        .deviationScore(field.getDeviationScore())
                        .contributionToAnomaly(0.0)
                        .build());
                if (Math.abs(field.getDeviationScore()) > Math.abs(target.getDeviationScore())) {
                    target.setDeviationScore(field.getDeviationScore());
                }
                target.setContributionToAnomaly(target.getContributionToAnomaly()
                        + share * field.getContributionToAnomaly());
            }
        }
        return new ArrayList<>(merged.values());
    }

    private AnomalyExplanation mergeExplanations(List<Weighted> group, DetectedAnomaly lead, int algorithmCount) {
        Set<String> factors = new LinkedHashSet<>();
        Set<String> reasons = new LinkedHashSet<>();
        Set<String> rules = new LinkedHashSet<>();
        AnomalyExplanation withEvidence = null;
        for (Weighted w : group) {
            AnomalyExplanation e = w.anomaly().getExplanation();
            if (e == null) continue;
            factors.addAll(e.getContributingFactors());
            reasons.addAll(e.getPossibleReasons());
            rules.addAll(e.getRulesBroken());
            if (withEvidence == null && e.getStatisticalEvidence() != null) {
                withEvidence = e;
            }
        }
        factors.add("Detected by " + algorithmCount + " algorithms");

        AnomalyExplanation leadExplanation = lead.getExplanation();
        AnomalyExplanation base = withEvidence != null ? withEvidence : leadExplanation;
        return AnomalyExplanation.builder()
                .primaryCause(base == null ? null : base.getPrimaryCause())
                .contributingFactors(new ArrayList<>(factors))
                .possibleReasons(new ArrayList<>(reasons))
                .rulesBroken(new ArrayList<>(rules))
                .statisticalEvidence(base == null ? null : base.getStatisticalEvidence())
                .patternAnalysis(base == null ? null : base.getPatternAnalysis())
                .build();
    }

    private record Weighted(DetectedAnomaly anomaly, double weight) {}
}
