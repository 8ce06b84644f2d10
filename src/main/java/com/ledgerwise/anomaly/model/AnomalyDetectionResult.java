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
public class AnomalyDetectionResult {

    private String requestId;

    private String organizationId;

    private String sourceId;

    private DetectionStatus status;

    private long detectionTimestamp;

    @Builder.Default
    private List<DetectedAnomaly> anomalies = new ArrayList<>();

    private DetectionSummary summary;

    @Builder.Default
    private List<DetectionRecommendation> recommendations = new ArrayList<>();

    private ModelPerformance modelPerformance;

    @Builder.Default
    private List<GeneratedAlert> alerts = new ArrayList<>();

    private long processingTimeMs;
}
