package com.ledgerwise.anomaly.engine.detectors;

import com.ledgerwise.anomaly.engine.AnomalyContexts;
import com.ledgerwise.anomaly.engine.FeatureMatrix;
import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.AnomalyExplanation;
import com.ledgerwise.anomaly.model.AnomalyType;
import com.ledgerwise.anomaly.model.BaselineMetric;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PatternAnalysis;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import com.ledgerwise.anomaly.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Shapes a multi-feature score into a {@link DetectedAnomaly}. Shared by the detectors that
 * score whole feature vectors rather than single fields.
 */
final class MultivariateAnomalyBuilder {

    private MultivariateAnomalyBuilder() {}

    static DetectedAnomaly build(AlgorithmType algorithm, String label,
                                 PreparedBatch batch, PreparedRecord record, HistoricalBaseline baseline,
                                 FeatureMatrix features, double[] shares,
                                 double score, double threshold, int surroundingWindow) {
        double ratio = threshold > 0 ? score / threshold : 1.0;

        List<AffectedField> fields = new ArrayList<>();
        for (int f = 0; f < features.featureCount(); f++) {
            String name = features.featureNames().get(f);
            BaselineMetric metric = baseline.getMetrics().get(name);
            fields.add(AffectedField.builder()
                    .fieldName(name)
                    .expectedValue(metric == null ? 0.0 : metric.getMean())
                    .actualValue(record.getValues().getOrDefault(name, 0.0))
                    .deviationScore(record.getNormalized().getOrDefault(name, 0.0))
                    .contributionToAnomaly(shares[f])
                    .build());
        }

        List<AffectedField> ranked = new ArrayList<>(fields);
        ranked.sort(Comparator.comparingDouble(AffectedField::getContributionToAnomaly).reversed());

        List<String> factors = new ArrayList<>();
        factors.add(String.format("%s score %.3f exceeds threshold %.3f", label, score, threshold));
        for (int k = 0; k < Math.min(3, ranked.size()); k++) {
            AffectedField top = ranked.get(k);
            if (top.getContributionToAnomaly() <= 0) break;
            factors.add(String.format("%s=%.2f (contribution %.0f%%)",
                    top.getFieldName(), top.getActualValue(), top.getContributionToAnomaly() * 100));
        }

        AnomalyExplanation explanation = AnomalyExplanation.builder()
                .primaryCause(String.format("Unusual combination of values, driven mostly by %s",
                        ranked.get(0).getFieldName()))
                .contributingFactors(factors)
                .rulesBroken(new ArrayList<>(List.of(
                        String.format("%s score > %.3f", label, threshold))))
                .patternAnalysis(PatternAnalysis.builder()
                        .expectedPattern(label + " score at or below " + String.format("%.3f", threshold))
                        .observedPattern(String.format("%s score %.3f", label, score))
                        .patternDeviation(ratio)
                        .seasonalityImpact(0.0)
                        .build())
                .build();

        return DetectedAnomaly.builder()
                .id(UUID.randomUUID().toString())
                .type(fields.size() > 1 ? AnomalyType.CONTEXTUAL : AnomalyType.POINT)
                .severity(Severity.fromRatio(ratio))
                .confidence(Math.min(DetectedAnomaly.MAX_CONFIDENCE, ratio * 0.8))
                .anomalyScore(score)
                .timestamp(record.getTimestamp())
                .recordIndex(record.getIndex())
                .detectedBy(new ArrayList<>(List.of(algorithm)))
                .affectedFields(fields)
                .context(AnomalyContexts.around(batch, record.getIndex(), surroundingWindow))
                .explanation(explanation)
                .build();
    }
}
