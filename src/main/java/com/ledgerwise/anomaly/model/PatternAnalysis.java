package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternAnalysis {

    private String expectedPattern;

    private String observedPattern;

    private double patternDeviation;

    private double seasonalityImpact;
}
