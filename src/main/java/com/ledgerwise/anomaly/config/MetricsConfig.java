package com.ledgerwise.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeProcessorCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeProcessorCount = registry.gauge("stream.processors.active", new AtomicInteger(0));
    }

    public void recordDetection(String status, int anomalyCount, long durationMs) {
        Counter.builder("detection.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.anomalies")
                .tag("status", status)
                .register(registry)
                .record(anomalyCount);

        Timer.builder("detection.duration")
                .tag("status", status)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordDetectorRun(String algorithm, String outcome, long durationMs) {
        Counter.builder("detector.run.count")
                .tag("algorithm", algorithm)
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("detector.run.duration")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordEnrichmentFailure(String reason) {
        Counter.builder("enrichment.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAlert(String severity, String outcome) {
        Counter.builder("alert.generated.count")
                .tag("severity", severity)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAlertTransition(String from, String to) {
        Counter.builder("alert.transition.count")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordEscalation(int level) {
        Counter.builder("alert.escalation.count")
                .tag("level", String.valueOf(level))
                .register(registry)
                .increment();
    }

    public void recordBatch(String processorId, String outcome, long recordCount) {
        Counter.builder("stream.batch.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("stream.batch.records")
                .tag("processor_id", processorId)
                .register(registry)
                .record(recordCount);
    }

    public void updateActiveProcessorCount(int count) {
        activeProcessorCount.set(count);
    }
}
