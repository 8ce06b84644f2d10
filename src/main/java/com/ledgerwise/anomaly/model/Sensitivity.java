package com.ledgerwise.anomaly.model;

public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH,
    CUSTOM
}
