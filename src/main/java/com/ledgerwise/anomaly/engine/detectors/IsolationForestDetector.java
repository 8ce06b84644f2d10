package com.ledgerwise.anomaly.engine.detectors;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.Detector;
import com.ledgerwise.anomaly.engine.DetectorContext;
import com.ledgerwise.anomaly.engine.FeatureMatrix;
import com.ledgerwise.anomaly.engine.isolationforest.IsolationForest;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.AnomalyAlgorithm;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Trains an isolation forest on the batch's normalized value fields and flags records that
 * isolate unusually fast.
 *
 * Catches multi-dimensional anomalies where each field is individually borderline-normal
 * but the combination is rare, complementing the per-field statistical detector.
 *
 * Parameters: {@code threshold} (default 0.6), {@code numTrees}, {@code sampleSize}, {@code seed}.
 */
@Component
public class IsolationForestDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    private final DetectionThresholdConfig thresholdConfig;

    public IsolationForestDetector(DetectionThresholdConfig thresholdConfig) {
        this.thresholdConfig = thresholdConfig;
    }

    @Override
    public AlgorithmType getSupportedAlgorithm() {
        return AlgorithmType.ML_ISOLATION_FOREST;
    }

    @Override
    public List<DetectedAnomaly> detect(PreparedBatch batch, HistoricalBaseline baseline,
                                        DetectionConfiguration config, DetectorContext context) {
        FeatureMatrix features = FeatureMatrix.normalized(batch);
        if (features.rowCount() < 2 || features.featureCount() == 0) {
            return List.of();
        }

        DetectionThresholdConfig.Isolation defaults = thresholdConfig.getIsolation();
        AnomalyAlgorithm algorithm = context.getAlgorithm();
        double threshold = algorithm.getParamAsDouble("threshold", defaults.getThreshold());
        int numTrees = (int) algorithm.getParamAsLong("numTrees", defaults.getNumTrees());
        int sampleSize = (int) algorithm.getParamAsLong("sampleSize", defaults.getSampleSize());
        long seed = algorithm.getParamAsLong("seed", defaults.getSeed());

        IsolationForest forest = IsolationForest.train(features.rows(), Math.max(1, numTrees),
                Math.max(2, sampleSize), seed);
        double[] means = features.columnMeans();

        List<DetectedAnomaly> anomalies = new ArrayList<>();
        List<PreparedRecord> records = batch.getRecords();
        for (int r = 0; r < records.size(); r++) {
            double[] point = features.rows()[r];
            double score = forest.score(point);
            if (score <= threshold) continue;

            double[] shares = FeatureMatrix.normalizeShares(forest.featureContributions(point, means));
            anomalies.add(MultivariateAnomalyBuilder.build(AlgorithmType.ML_ISOLATION_FOREST, "Isolation forest",
                    batch, records.get(r), baseline, features, shares, score, threshold,
                    thresholdConfig.getSurroundingWindow()));
        }

        log.debug("Isolation forest batch={} trees={} records={} flagged={}",
                context.getBatchId(), forest.size(), records.size(), anomalies.size());
        return anomalies;
    }
}
