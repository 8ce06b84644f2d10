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
public class StreamBatchResult {

    private String processorId;

    private DetectionStatus status;

    @Builder.Default
    private List<DetectedAnomaly> anomalies = new ArrayList<>();

    @Builder.Default
    private List<GeneratedAlert> alerts = new ArrayList<>();

    private long processingTimeMs;
}
