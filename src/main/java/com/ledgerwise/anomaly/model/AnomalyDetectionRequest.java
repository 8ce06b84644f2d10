package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetectionRequest {

    private String id;

    private String organizationId;

    private String userId;

    private DataSource dataSource;

    private DetectionConfiguration detectionConfig;

    private AlertConfiguration alertConfig;

    private DetectionContext context;
}
