package com.ledgerwise.anomaly.model;

public enum RecommendationType {
    IMMEDIATE_ACTION,
    INVESTIGATION,
    PROCESS_IMPROVEMENT,
    MONITORING_ENHANCEMENT
}
