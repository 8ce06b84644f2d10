package com.ledgerwise.anomaly.model;

public enum AlertChannelType {
    EMAIL,
    SMS,
    SLACK,
    WEBHOOK,
    IN_APP
}
