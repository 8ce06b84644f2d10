package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.DetectorOutcome;
import com.ledgerwise.anomaly.model.AlgorithmPerformance;
import com.ledgerwise.anomaly.model.AnomalyAlgorithm;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.ModelPerformance;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports what each configured algorithm contributed to a run. Measured values only:
 * weights, run times, anomaly counts and how often algorithms agreed.
 */
@Service
public class ModelPerformanceService {

    private final DetectionThresholdConfig config;

    public ModelPerformanceService(DetectionThresholdConfig config) {
        this.config = config;
    }

    public ModelPerformance evaluate(List<DetectorOutcome> outcomes, List<DetectedAnomaly> finalAnomalies,
                                     boolean ensembleApplied) {
        double totalWeight = 0.0;
        for (DetectorOutcome outcome : outcomes) {
            totalWeight += Math.max(0.0, weightOf(outcome.getAlgorithm()));
        }

        List<AlgorithmPerformance> algorithms = new ArrayList<>(outcomes.size());
        for (DetectorOutcome outcome : outcomes) {
            double weight = Math.max(0.0, weightOf(outcome.getAlgorithm()));
            algorithms.add(AlgorithmPerformance.builder()
                    .algorithm(outcome.getAlgorithm() == null ? null : outcome.getAlgorithm().getType())
                    .weight(weight)
                    .contribution(totalWeight > 0 ? weight / totalWeight : 1.0 / outcomes.size())
                    .anomaliesFound(outcome.getAnomalies().size())
                    .processingTimeMs(outcome.getDurationMs())
                    .succeeded(outcome.isSucceeded())
                    .build());
        }

        long agreed = finalAnomalies.stream().filter(a -> a.getDetectedBy().size() > 1).count();
        double agreementRate = ensembleApplied && !finalAnomalies.isEmpty()
                ? (double) agreed / finalAnomalies.size()
                : 0.0;

        return ModelPerformance.builder()
                .algorithms(algorithms)
                .agreementRate(agreementRate)
                .ensembleApplied(ensembleApplied)
                .modelVersion(config.getModelVersion())
                .evaluatedAt(System.currentTimeMillis())
                .build();
    }

    private static double weightOf(AnomalyAlgorithm algorithm) {
        return algorithm == null ? 0.0 : algorithm.getWeight();
    }
}
