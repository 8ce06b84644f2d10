package com.ledgerwise.anomaly.engine.detectors;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.Detector;
import com.ledgerwise.anomaly.engine.DetectorContext;
import com.ledgerwise.anomaly.engine.FeatureMatrix;
import com.ledgerwise.anomaly.engine.oneclass.SupportBoundary;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One-class detector: fits a spherical boundary around the normalized feature centroid and
 * flags records outside it. The score is distance / radius, so 1.0 sits on the boundary.
 */
@Component
public class OneClassBoundaryDetector implements Detector {

    private final DetectionThresholdConfig thresholdConfig;

    public OneClassBoundaryDetector(DetectionThresholdConfig thresholdConfig) {
        this.thresholdConfig = thresholdConfig;
    }

    @Override
    public AlgorithmType getSupportedAlgorithm() {
        return AlgorithmType.ML_ONE_CLASS_SVM;
    }

    @Override
    public List<DetectedAnomaly> detect(PreparedBatch batch, HistoricalBaseline baseline,
                                        DetectionConfiguration config, DetectorContext context) {
        FeatureMatrix features = FeatureMatrix.normalized(batch);
        if (features.rowCount() < 2 || features.featureCount() == 0) {
            return List.of();
        }

        double nu = context.getAlgorithm().getParamAsDouble("nu", thresholdConfig.getOneClass().getNu());
        SupportBoundary boundary = SupportBoundary.fit(features.rows(), nu);

        List<DetectedAnomaly> anomalies = new ArrayList<>();
        List<PreparedRecord> records = batch.getRecords();
        for (int r = 0; r < records.size(); r++) {
            double[] point = features.rows()[r];
            if (!boundary.isOutside(point)) continue;

            double score = boundary.distance(point) / boundary.radius();
            double[] shares = FeatureMatrix.normalizeShares(boundary.squaredDistanceTerms(point));
            anomalies.add(MultivariateAnomalyBuilder.build(AlgorithmType.ML_ONE_CLASS_SVM, "Support boundary",
                    batch, records.get(r), baseline, features, shares, score, 1.0,
                    thresholdConfig.getSurroundingWindow()));
        }
        return anomalies;
    }
}
