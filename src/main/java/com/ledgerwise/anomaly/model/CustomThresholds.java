package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomThresholds {

    // z-score threshold for the statistical detector
    private double statisticalThreshold;

    // percentile threshold, e.g. 95
    private double percentileThreshold;

    private Double absoluteThreshold;

    private Double relativeChangeThreshold;
}
