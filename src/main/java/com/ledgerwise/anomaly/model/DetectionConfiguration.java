package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-owned detection settings. Read-only to the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionConfiguration {

    @Builder.Default
    private List<AnomalyAlgorithm> algorithms = new ArrayList<>();

    @Builder.Default
    private Sensitivity sensitivity = Sensitivity.MEDIUM;

    private CustomThresholds customThresholds;

    // e.g. "1h", "1d", "1w"
    private String aggregationWindow;

    // 0 means "use the engine default"
    private int minimumSamples;

    private boolean seasonalityAware;

    private boolean contextualDetection;

    private boolean multiVariateAnalysis;
}
