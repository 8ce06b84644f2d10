package com.ledgerwise.anomaly.model;

public enum Urgency {
    IMMEDIATE,
    URGENT,
    STANDARD,
    LOW
}
