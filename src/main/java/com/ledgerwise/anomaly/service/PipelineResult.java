package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.engine.DetectorOutcome;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionStatus;
import com.ledgerwise.anomaly.model.GeneratedAlert;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one pass of the detection pipeline produced for a batch.
 */
@Data
@Builder
public class PipelineResult {

    private DetectionStatus status;

    @Builder.Default
    private List<DetectedAnomaly> anomalies = new ArrayList<>();

    @Builder.Default
    private List<GeneratedAlert> alerts = new ArrayList<>();

    @Builder.Default
    private List<DetectorOutcome> outcomes = new ArrayList<>();

    private boolean ensembleApplied;

    private int minimumSamples;
}
