package com.ledgerwise.anomaly.model;

public enum AnomalyType {
    POINT,
    CONTEXTUAL,
    COLLECTIVE,
    TREND
}
