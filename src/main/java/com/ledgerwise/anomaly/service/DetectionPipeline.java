package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.DetectorOutcome;
import com.ledgerwise.anomaly.engine.DetectorRegistry;
import com.ledgerwise.anomaly.engine.EnsembleCombiner;
import com.ledgerwise.anomaly.model.AlertConfiguration;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.DetectionContext;
import com.ledgerwise.anomaly.model.DetectionStatus;
import com.ledgerwise.anomaly.model.GeneratedAlert;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Detection steps shared by one-shot requests and stream processors:
 * sufficiency check, detectors, ensemble, enrichment, alerts.
 */
@Service
public class DetectionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final DetectorRegistry detectorRegistry;
    private final EnsembleCombiner ensembleCombiner;
    private final AnomalyEnrichmentService enrichmentService;
    private final AlertGenerationService alertGenerationService;
    private final BaselineService baselineService;
    private final DetectionThresholdConfig thresholdConfig;

    public DetectionPipeline(DetectorRegistry detectorRegistry,
                             EnsembleCombiner ensembleCombiner,
                             AnomalyEnrichmentService enrichmentService,
                             AlertGenerationService alertGenerationService,
                             BaselineService baselineService,
                             DetectionThresholdConfig thresholdConfig) {
        this.detectorRegistry = detectorRegistry;
        this.ensembleCombiner = ensembleCombiner;
        this.enrichmentService = enrichmentService;
        this.alertGenerationService = alertGenerationService;
        this.baselineService = baselineService;
        this.thresholdConfig = thresholdConfig;
    }

    @Observed(name = "detection.pipeline", contextualName = "run-detection-pipeline")
    public PipelineResult run(PreparedBatch batch, HistoricalBaseline baseline,
                              DetectionConfiguration config, AlertConfiguration alertConfig,
                              DetectionContext context, String batchId,
                              String organizationId, String sourceId) {
        int minimumSamples = thresholdConfig.resolveMinimumSamples(config);
        if (!baselineService.hasSufficientData(baseline, minimumSamples)) {
            log.info("Insufficient data for batch {}: baseline has {} samples, {} required",
                    batchId, baseline == null ? 0 : baseline.getSampleCount(), minimumSamples);
            return PipelineResult.builder()
                    .status(DetectionStatus.INSUFFICIENT_DATA)
                    .minimumSamples(minimumSamples)
                    .build();
        }

        List<DetectorOutcome> outcomes = detectorRegistry.runAll(batch, baseline, config,
                batchId, organizationId, sourceId, context);

        boolean ensemble = config.getAlgorithms().size() > 1;
        List<DetectedAnomaly> anomalies = ensemble
                ? ensembleCombiner.combine(outcomes)
                : EnsembleCombiner.flatten(outcomes);

        enrichmentService.enrich(anomalies, context, batchId);
        List<GeneratedAlert> alerts = alertGenerationService.generate(anomalies, alertConfig, organizationId, sourceId);

        log.debug("Pipeline batch={} records={} anomalies={} alerts={}",
                batchId, batch.size(), anomalies.size(), alerts.size());

        return PipelineResult.builder()
                .status(DetectionStatus.COMPLETED)
                .anomalies(anomalies)
                .alerts(alerts)
                .outcomes(outcomes)
                .ensembleApplied(ensemble)
                .minimumSamples(minimumSamples)
                .build();
    }
}
