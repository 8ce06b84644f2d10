package com.ledgerwise.anomaly.model;

public enum DataSourceType {
    FINANCIAL_TRANSACTIONS,
    PERFORMANCE_METRICS,
    COMPLIANCE_DATA,
    OPERATIONAL_DATA,
    CLIENT_BEHAVIOR
}
