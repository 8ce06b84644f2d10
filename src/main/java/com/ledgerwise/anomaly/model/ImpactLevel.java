package com.ledgerwise.anomaly.model;

public enum ImpactLevel {
    MINIMAL,
    MINOR,
    MODERATE,
    MAJOR,
    SEVERE
}
