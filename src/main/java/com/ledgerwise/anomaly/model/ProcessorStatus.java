package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time snapshot of a stream processor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessorStatus {

    private String processorId;

    private boolean running;

    // epoch millis of the last completed batch, 0 if none
    private long lastProcessed;

    private long totalProcessed;

    private long totalBatches;

    private long failedBatches;

    private double errorRate;

    // ms spent on the last batch
    private long latency;

    private int queueSize;
}
