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
public class AnomalyExplanation {

    private String primaryCause;

    @Builder.Default
    private List<String> contributingFactors = new ArrayList<>();

    @Builder.Default
    private List<String> possibleReasons = new ArrayList<>();

    @Builder.Default
    private List<String> rulesBroken = new ArrayList<>();

    private StatisticalEvidence statisticalEvidence;

    private PatternAnalysis patternAnalysis;
}
