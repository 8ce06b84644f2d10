package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.AnomalyAlgorithm;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What a single detector produced for a batch, including failures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectorOutcome {

    private AnomalyAlgorithm algorithm;

    @Builder.Default
    private List<DetectedAnomaly> anomalies = new ArrayList<>();

    private long durationMs;

    private boolean succeeded;

    // set when the detector threw or no detector is registered
    private String failureReason;
}
