package com.ledgerwise.anomaly.exception;

public class ProcessorOverloadedException extends IllegalStateException {

    public ProcessorOverloadedException(String processorId, int queued) {
        super("Stream processor " + processorId + " has " + queued + " batches waiting; rejecting new batch");
    }
}
