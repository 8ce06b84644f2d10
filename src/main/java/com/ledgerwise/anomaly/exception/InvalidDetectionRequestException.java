package com.ledgerwise.anomaly.exception;

/**
 * Raised when a detection request is structurally unusable (no data, no algorithms,
 * no alert configuration, or no value fields).
 */
public class InvalidDetectionRequestException extends IllegalArgumentException {

    public InvalidDetectionRequestException(String message) {
        super(message);
    }
}
