package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPerformance {

    @Builder.Default
    private List<AlgorithmPerformance> algorithms = new ArrayList<>();

    // merged anomalies / final anomalies; 0 without an ensemble
    private double agreementRate;

    private boolean ensembleApplied;

    private String modelVersion;

    private long evaluatedAt;
}
