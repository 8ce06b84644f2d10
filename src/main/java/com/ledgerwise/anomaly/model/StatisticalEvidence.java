package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticalEvidence {

    private double zScore;

    // 0-100
    private double percentile;

    private double probabilityOfOccurrence;

    private ValueRange confidenceInterval;
}
