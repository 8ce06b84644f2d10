package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedField {

    private String fieldName;

    private double expectedValue;

    private double actualValue;

    private double deviationScore;

    // share of the anomaly attributed to this field; sums to 1.0 across an anomaly
    private double contributionToAnomaly;
}
