package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlgorithmPerformance {

    private AlgorithmType algorithm;

    private double weight;

    // weight / sum of configured weights
    private double contribution;

    private int anomaliesFound;

    private long processingTimeMs;

    private boolean succeeded;
}
