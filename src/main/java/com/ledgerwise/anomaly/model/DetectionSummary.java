package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionSummary {

    private int totalAnomalies;

    @Builder.Default
    private Map<Severity, Integer> severityBreakdown = new EnumMap<>(Severity.class);

    @Builder.Default
    private Map<AnomalyType, Integer> typeBreakdown = new EnumMap<>(AnomalyType.class);

    private TimeRange timeRange;

    private int recordsAnalyzed;

    // fraction of submitted records that survived preparation
    private double dataCoverage;

    @Builder.Default
    private List<String> dataQualityIssues = new ArrayList<>();

    private long processingTimeMs;

    private int alertsGenerated;
}
