package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedAlert {

    private String id;

    private String anomalyId;

    private String organizationId;

    private String sourceId;

    private Severity severity;

    private String title;

    private String message;

    private long timestamp;

    // earliest dispatch time; equals timestamp outside business-hours gating
    private long deliverAfter;

    @Builder.Default
    private List<AlertChannelType> channels = new ArrayList<>();

    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    @Builder.Default
    private AlertStatus status = AlertStatus.PENDING;

    private int escalationLevel;

    @Builder.Default
    private Map<String, Object> businessContext = new HashMap<>();

    // anomaly attributes (severity, field, category, ...) used to match escalation conditions
    @Builder.Default
    private Map<String, List<String>> attributes = new HashMap<>();

    private Long sentAt;
    private Long acknowledgedAt;
    private String acknowledgedBy;
    private Long resolvedAt;
    private Long lastEscalatedAt;
}
