package com.ledgerwise.anomaly.exception;

public class ProcessorStoppedException extends IllegalStateException {

    public ProcessorStoppedException(String processorId) {
        super("Stream processor " + processorId + " is not running");
    }
}
