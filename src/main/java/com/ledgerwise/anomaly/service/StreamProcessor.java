package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.exception.ProcessorOverloadedException;
import com.ledgerwise.anomaly.exception.ProcessorStoppedException;
import com.ledgerwise.anomaly.model.AnomalyDetectionRequest;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.ProcessorStatus;
import com.ledgerwise.anomaly.model.StreamBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Continuous detection for one (organization, data source), created by
 * {@link AnomalyDetectionService#startRealTimeDetection}.
 *
 * Batches and baseline updates are serialized by a fair lock, so callers are served in
 * arrival order. {@link #getStatus()} never takes the lock.
 */
public class StreamProcessor {

    private static final Logger log = LoggerFactory.getLogger(StreamProcessor.class);

    private final String processorId;
    private final AnomalyDetectionRequest request;
    private final DataPreparationService preparationService;
    private final BaselineService baselineService;
    private final DetectionPipeline pipeline;
    private final MetricsConfig metricsConfig;
    private final int maxQueuedBatches;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<HistoricalBaseline> baseline = new AtomicReference<>();
    private final AtomicInteger waiting = new AtomicInteger();

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalBatches = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final AtomicLong lastProcessed = new AtomicLong();
    private final AtomicLong lastLatencyMs = new AtomicLong();

    public StreamProcessor(String processorId, AnomalyDetectionRequest request,
                           DataPreparationService preparationService, BaselineService baselineService,
                           DetectionPipeline pipeline, MetricsConfig metricsConfig, int maxQueuedBatches) {
        this.processorId = processorId;
        this.request = request;
        this.preparationService = preparationService;
        this.baselineService = baselineService;
        this.pipeline = pipeline;
        this.metricsConfig = metricsConfig;
        this.maxQueuedBatches = maxQueuedBatches;
    }

    /**
     * Load the initial baseline from the request's data and begin accepting batches.
     * Calling start on a running processor does nothing.
     */
    public void start() {
        lock.lock();
        try {
            if (running.get()) return;
            baseline.set(baselineService.getOrCreate(organizationId(), sourceId(), request.getDataSource()));
            running.set(true);
            log.info("Stream processor {} started for {}:{} (baseline samples={})",
                    processorId, organizationId(), sourceId(), baseline.get().getSampleCount());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop accepting batches and wait for the batch in flight, if any. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        // acquiring the lock waits out the in-flight batch
        lock.lock();
        lock.unlock();
        log.info("Stream processor {} stopped after {} batches ({} records)",
                processorId, totalBatches.get(), totalProcessed.get());
    }

    public StreamBatchResult processDataStream(List<?> data) {
        acquire();
        long start = System.currentTimeMillis();
        String batchId = processorId + ":" + sequence.incrementAndGet();
        try {
            PreparedBatch batch = preparationService.prepare(data == null ? List.of() : data,
                    request.getDataSource().getMetadata());

            PipelineResult result = pipeline.run(batch, baseline.get(),
                    request.getDetectionConfig(), request.getAlertConfig(), request.getContext(),
                    batchId, organizationId(), sourceId());

            long latency = System.currentTimeMillis() - start;
            totalProcessed.addAndGet(batch.size());
            totalBatches.incrementAndGet();
            lastProcessed.set(System.currentTimeMillis());
            lastLatencyMs.set(latency);
            metricsConfig.recordBatch(processorId, "success", batch.size());

            return StreamBatchResult.builder()
                    .processorId(processorId)
                    .status(result.getStatus())
                    .anomalies(result.getAnomalies())
                    .alerts(result.getAlerts())
                    .processingTimeMs(latency)
                    .build();
        } catch (RuntimeException e) {
            totalBatches.incrementAndGet();
            failedBatches.incrementAndGet();
            lastLatencyMs.set(System.currentTimeMillis() - start);
            metricsConfig.recordBatch(processorId, "failure", data == null ? 0 : data.size());
            log.error("Stream processor {} failed on batch {}: {}", processorId, batchId, e.getMessage(), e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rebuild the baseline from the given records and swap it in, for this processor and
     * for one-shot detection on the same source.
     */
    public void updateBaseline(List<?> data) {
        acquire();
        try {
            PreparedBatch batch = preparationService.prepare(data == null ? List.of() : data,
                    request.getDataSource().getMetadata());
            HistoricalBaseline fresh = baselineService.buildBaseline(batch);
            baseline.set(fresh);
            baselineService.replace(organizationId(), sourceId(), fresh);
            log.info("Stream processor {} baseline updated: samples={}", processorId, fresh.getSampleCount());
        } finally {
            lock.unlock();
        }
    }

    public ProcessorStatus getStatus() {
        long batches = totalBatches.get();
        return ProcessorStatus.builder()
                .processorId(processorId)
                .running(running.get())
                .lastProcessed(lastProcessed.get())
                .totalProcessed(totalProcessed.get())
                .totalBatches(batches)
                .failedBatches(failedBatches.get())
                .errorRate(batches == 0 ? 0.0 : (double) failedBatches.get() / batches)
                .latency(lastLatencyMs.get())
                .queueSize(waiting.get())
                .build();
    }

    public HistoricalBaseline getBaseline() {
        return baseline.get();
    }

    public String getProcessorId() {
        return processorId;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Take the processor lock, rejecting the caller when stopped or when too many are waiting.
     * On return the lock is held.
     */
    private void acquire() {
        if (!running.get()) {
            throw new ProcessorStoppedException(processorId);
        }
        int queued = waiting.incrementAndGet();
        if (queued > maxQueuedBatches) {
            waiting.decrementAndGet();
            throw new ProcessorOverloadedException(processorId, queued - 1);
        }
        lock.lock();
        waiting.decrementAndGet();
        if (!running.get()) {
            lock.unlock();
            throw new ProcessorStoppedException(processorId);
        }
    }

    private String organizationId() {
        return String.valueOf(request.getOrganizationId());
    }

    private String sourceId() {
        return String.valueOf(request.getDataSource().getSourceId());
    }
}
