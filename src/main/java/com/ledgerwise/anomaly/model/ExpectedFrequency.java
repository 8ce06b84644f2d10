package com.ledgerwise.anomaly.model;

public enum ExpectedFrequency {
    REAL_TIME,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY
}
