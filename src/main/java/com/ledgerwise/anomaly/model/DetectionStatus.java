package com.ledgerwise.anomaly.model;

public enum DetectionStatus {
    COMPLETED,
    INSUFFICIENT_DATA
}
