package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;

import java.util.List;

/**
 * Interface for all anomaly detection strategies.
 * Each implementation handles a specific AlgorithmType.
 */
public interface Detector {

    /**
     * The algorithm this detector implements.
     */
    AlgorithmType getSupportedAlgorithm();

    /**
     * Score a prepared batch and return the records it considers anomalous.
     * Implementations must not mutate the batch or the baseline; both are shared
     * with the other detectors running on the same batch.
     *
     * @param batch    the prepared records, sorted by timestamp
     * @param baseline reference statistics for the data source
     * @param config   the caller's detection configuration
     * @param context  per-run identifiers and the algorithm entry being executed
     * @return anomalies found, possibly empty, never null
     */
    List<DetectedAnomaly> detect(PreparedBatch batch, HistoricalBaseline baseline,
                                 DetectionConfiguration config, DetectorContext context);
}
