package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineMetric {

    private String field;

    private double mean;

    // population standard deviation, 0 for constant fields
    private double std;

    private double min;

    private double max;

    // "p25", "p50", "p75", "p90", "p95", "p99"
    @Builder.Default
    private Map<String, Double> percentiles = new LinkedHashMap<>();
}
