package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.AnomalyAlgorithm;
import com.ledgerwise.anomaly.model.DetectionContext;
import lombok.Builder;
import lombok.Data;

/**
 * Runtime identifiers passed to detectors alongside the batch and baseline.
 */
@Data
@Builder
public class DetectorContext {

    // request id for one-shot detection, processorId:sequence for stream batches
    private String batchId;

    private String organizationId;

    private String sourceId;

    // the configured entry being executed, carries parameters and weight
    private AnomalyAlgorithm algorithm;

    private DetectionContext detectionContext;
}
