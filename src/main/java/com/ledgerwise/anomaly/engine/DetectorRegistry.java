package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.AnomalyAlgorithm;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.DetectionContext;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs the configured detection algorithms against a prepared batch.
 * Uses the Strategy pattern: each AlgorithmType is handled by a registered Detector.
 * Detectors for one batch run concurrently and are all joined before this method returns.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<AlgorithmType, Detector> detectorMap;
    private final ExecutorService detectionExecutor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectorRegistry(List<Detector> detectors,
                            @Qualifier("detectionExecutor") ExecutorService detectionExecutor,
                            Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(AlgorithmType.class);
        this.detectionExecutor = detectionExecutor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (Detector detector : detectors) {
            detectorMap.put(detector.getSupportedAlgorithm(), detector);
            log.info("Registered detector: {} -> {}",
                    detector.getSupportedAlgorithm(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run every configured algorithm against the batch.
     *
     * @return one outcome per configured algorithm, in configuration order. Failed or
     *         unregistered algorithms yield an outcome with no anomalies.
     */
    @Observed(name = "detectors.run_all", contextualName = "run-all-detectors")
    public List<DetectorOutcome> runAll(PreparedBatch batch, HistoricalBaseline baseline,
                                        DetectionConfiguration config, String batchId,
                                        String organizationId, String sourceId,
                                        DetectionContext detectionContext) {
        List<CompletableFuture<DetectorOutcome>> futures = new ArrayList<>();

        for (AnomalyAlgorithm algorithm : config.getAlgorithms()) {
            Detector detector = detectorMap.get(algorithm.getType());
            if (detector == null) {
                log.warn("No detector registered for algorithm: {}, batch: {}", algorithm.getType(), batchId);
                futures.add(CompletableFuture.completedFuture(DetectorOutcome.builder()
                        .algorithm(algorithm)
                        .succeeded(false)
                        .failureReason("No detector registered for " + algorithm.getType())
                        .build()));
                continue;
            }

            DetectorContext context = DetectorContext.builder()
                    .batchId(batchId)
                    .organizationId(organizationId)
                    .sourceId(sourceId)
                    .algorithm(algorithm)
                    .detectionContext(detectionContext)
                    .build();

            futures.add(CompletableFuture.supplyAsync(
                    () -> runOne(detector, batch, baseline, config, context), detectionExecutor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<DetectorOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<DetectorOutcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    private DetectorOutcome runOne(Detector detector, PreparedBatch batch, HistoricalBaseline baseline,
                                   DetectionConfiguration config, DetectorContext context) {
        AnomalyAlgorithm algorithm = context.getAlgorithm();
        Span span = tracer.nextSpan()
                .name("detector.run." + algorithm.getType())
                .tag("detector.algorithm", algorithm.getType().name())
                .tag("detector.batch_id", String.valueOf(context.getBatchId()))
                .tag("detector.records", String.valueOf(batch.size()))
                .start();

        long start = System.nanoTime();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<DetectedAnomaly> anomalies = detector.detect(batch, baseline, config, context);
            long durationMs = elapsedMs(start);

            span.tag("detector.anomalies", String.valueOf(anomalies.size()));
            metricsConfig.recordDetectorRun(algorithm.getType().name(), "success", durationMs);
            log.debug("Detector {} found {} anomalies in batch {} ({} ms)",
                    algorithm.getType(), anomalies.size(), context.getBatchId(), durationMs);

            return DetectorOutcome.builder()
                    .algorithm(algorithm)
                    .anomalies(new ArrayList<>(anomalies))
                    .durationMs(durationMs)
                    .succeeded(true)
                    .build();
        } catch (Exception e) {
            span.error(e);
            long durationMs = elapsedMs(start);
            metricsConfig.recordDetectorRun(algorithm.getType().name(), "failure", durationMs);
            log.error("Detector {} failed on batch {}: {}",
                    algorithm.getType(), context.getBatchId(), e.getMessage(), e);
            // One failing detector never blocks the others
            return DetectorOutcome.builder()
                    .algorithm(algorithm)
                    .durationMs(durationMs)
                    .succeeded(false)
                    .failureReason(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .build();
        } finally {
            span.end();
        }
    }

    public Set<AlgorithmType> getRegisteredAlgorithms() {
        return detectorMap.keySet();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
