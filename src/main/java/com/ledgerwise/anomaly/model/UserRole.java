package com.ledgerwise.anomaly.model;

public enum UserRole {
    PARTNER,
    MANAGER,
    ASSOCIATE,
    INTERN
}
