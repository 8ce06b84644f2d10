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
public class DetectedAnomaly {

    public static final double MAX_CONFIDENCE = 0.95;

    private String id;

    private AnomalyType type;

    private Severity severity;

    // 0 - MAX_CONFIDENCE
    private double confidence;

    private double anomalyScore;

    // epoch millis of the offending record; null when the record has none
    private Long timestamp;

    // position of the record in the prepared (sorted) batch
    private int recordIndex;

    @Builder.Default
    private List<AlgorithmType> detectedBy = new ArrayList<>();

    @Builder.Default
    private List<AffectedField> affectedFields = new ArrayList<>();

    private AnomalyContext context;

    private AnomalyExplanation explanation;

    private BusinessImpact businessImpact;
}
