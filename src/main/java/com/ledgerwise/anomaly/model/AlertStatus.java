package com.ledgerwise.anomaly.model;

public enum AlertStatus {
    PENDING,
    SENT,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean canTransitionTo(AlertStatus next) {
        return switch (this) {
            case PENDING -> next == SENT || next == RESOLVED;
            case SENT -> next == ACKNOWLEDGED || next == RESOLVED;
            case ACKNOWLEDGED -> next == RESOLVED;
            case RESOLVED -> false;
        };
    }
}
