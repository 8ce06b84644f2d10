package com.ledgerwise.anomaly.model;

public enum RecommendationPriority {
    HIGH,
    MEDIUM,
    LOW
}
