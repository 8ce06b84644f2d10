package com.ledgerwise.anomaly.model;

public enum ImpactCategory {
    FINANCIAL,
    OPERATIONAL,
    COMPLIANCE,
    REPUTATIONAL,
    STRATEGIC
}
