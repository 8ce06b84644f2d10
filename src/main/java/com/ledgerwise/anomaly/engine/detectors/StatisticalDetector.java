package com.ledgerwise.anomaly.engine.detectors;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.AnomalyContexts;
import com.ledgerwise.anomaly.engine.Detector;
import com.ledgerwise.anomaly.engine.DetectorContext;
import com.ledgerwise.anomaly.engine.SampleStatistics;
import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.AnomalyExplanation;
import com.ledgerwise.anomaly.model.AnomalyType;
import com.ledgerwise.anomaly.model.BaselineMetric;
import com.ledgerwise.anomaly.model.BaselinePattern;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PatternAnalysis;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import com.ledgerwise.anomaly.model.Severity;
import com.ledgerwise.anomaly.model.StatisticalEvidence;
import com.ledgerwise.anomaly.model.ValueRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Flags field values whose z-score against the baseline exceeds the sensitivity threshold.
 *
 * Threshold: the custom statistical threshold when set, otherwise 3.0 / 2.5 / 2.0 for
 * LOW / MEDIUM / HIGH sensitivity. A field with zero standard deviation never triggers.
 */
@Component
public class StatisticalDetector implements Detector {

    private final DetectionThresholdConfig thresholdConfig;

    public StatisticalDetector(DetectionThresholdConfig thresholdConfig) {
        this.thresholdConfig = thresholdConfig;
    }

    @Override
    public AlgorithmType getSupportedAlgorithm() {
        return AlgorithmType.STATISTICAL;
    }

    @Override
    public List<DetectedAnomaly> detect(PreparedBatch batch, HistoricalBaseline baseline,
                                        DetectionConfiguration config, DetectorContext context) {
        double threshold = thresholdConfig.resolveZScoreThreshold(config);
        List<DetectedAnomaly> anomalies = new ArrayList<>();

        for (PreparedRecord record : batch.getRecords()) {
            for (BaselineMetric metric : baseline.getMetrics().values()) {
                Double value = record.getValues().get(metric.getField());
                if (value == null) continue;

                double z = SampleStatistics.zScore(value, metric.getMean(), metric.getStd());
                double absZ = Math.abs(z);
                if (absZ <= threshold) continue;

                anomalies.add(buildAnomaly(batch, record, metric, value, z, threshold, baseline, config));
            }
        }
        return anomalies;
    }

    private DetectedAnomaly buildAnomaly(PreparedBatch batch, PreparedRecord record, BaselineMetric metric,
                                         double value, double z, double threshold,
                                         HistoricalBaseline baseline, DetectionConfiguration config) {
        double absZ = Math.abs(z);
        double ratio = absZ / threshold;
        String direction = z > 0 ? "above" : "below";
        double lower = metric.getMean() - threshold * metric.getStd();
        double upper = metric.getMean() + threshold * metric.getStd();

        List<String> factors = new ArrayList<>();
        factors.add(String.format("Z-score %.2f exceeds threshold %.2f", z, threshold));
        factors.add(String.format("Value is %s the expected range [%.2f, %.2f]", direction, lower, upper));

        double seasonality = config.isSeasonalityAware() ? strongestPattern(baseline, metric.getField()) : 0.0;
        if (seasonality > 0) {
            factors.add(String.format("Field shows periodic behaviour (strength %.2f)", seasonality));
        }

        StatisticalEvidence evidence = StatisticalEvidence.builder()
                .zScore(z)
                .percentile(SampleStatistics.percentileRank(value, metric))
                .probabilityOfOccurrence(SampleStatistics.twoSidedTailProbability(z))
                .confidenceInterval(new ValueRange(metric.getMean() - 2 * metric.getStd(),
                        metric.getMean() + 2 * metric.getStd()))
                .build();

        AnomalyExplanation explanation = AnomalyExplanation.builder()
                .primaryCause(String.format("%s value %.2f is %.2f standard deviations %s the baseline mean %.2f",
                        metric.getField(), value, absZ, direction, metric.getMean()))
                .contributingFactors(factors)
                .rulesBroken(new ArrayList<>(List.of(
                        String.format("|z| > %.2f on %s", threshold, metric.getField()))))
                .statisticalEvidence(evidence)
                .patternAnalysis(PatternAnalysis.builder()
                        .expectedPattern(String.format("%s within [%.2f, %.2f]", metric.getField(), lower, upper))
                        .observedPattern(String.format("%s = %.2f", metric.getField(), value))
                        .patternDeviation(absZ)
                        .seasonalityImpact(seasonality)
                        .build())
                .build();

        AffectedField field = AffectedField.builder()
                .fieldName(metric.getField())
                .expectedValue(metric.getMean())
                .actualValue(value)
                .deviationScore(z)
                .contributionToAnomaly(1.0)
                .build();

        return DetectedAnomaly.builder()
                .id(UUID.randomUUID().toString())
                .type(AnomalyType.POINT)
                .severity(Severity.fromRatio(ratio))
                .confidence(Math.min(DetectedAnomaly.MAX_CONFIDENCE, ratio * 0.8))
                .anomalyScore(absZ)
                .timestamp(record.getTimestamp())
                .recordIndex(record.getIndex())
                .detectedBy(new ArrayList<>(List.of(AlgorithmType.STATISTICAL)))
                .affectedFields(new ArrayList<>(List.of(field)))
                .context(AnomalyContexts.around(batch, record.getIndex(), thresholdConfig.getSurroundingWindow()))
                .explanation(explanation)
                .build();
    }

    private double strongestPattern(HistoricalBaseline baseline, String field) {
        double strongest = 0.0;
        String prefix = field + ":";
        for (BaselinePattern pattern : baseline.getPatterns()) {
            if (pattern.getPattern() != null && pattern.getPattern().startsWith(prefix)) {
                strongest = Math.max(strongest, pattern.getStrength());
            }
        }
        return strongest;
    }
}
