package com.ledgerwise.anomaly.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Maps how far a score exceeds its threshold (score / threshold) onto a severity.
     */
    public static Severity fromRatio(double ratio) {
        if (ratio > 2.0) return CRITICAL;
        if (ratio > 1.5) return HIGH;
        if (ratio > 1.2) return MEDIUM;
        return LOW;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || this.ordinal() > other.ordinal();
    }
}
