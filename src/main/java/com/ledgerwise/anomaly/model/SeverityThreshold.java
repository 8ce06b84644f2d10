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
public class SeverityThreshold {

    // minimum anomaly score for an alert of this tier
    private double threshold;

    @Builder.Default
    private List<String> conditions = new ArrayList<>();
}
