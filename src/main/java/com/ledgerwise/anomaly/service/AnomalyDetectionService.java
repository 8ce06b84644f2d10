package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.config.EnrichmentConfig;
import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.engine.DetectorRegistry;
import com.ledgerwise.anomaly.exception.InvalidDetectionRequestException;
import com.ledgerwise.anomaly.model.AlertChannelType;
import com.ledgerwise.anomaly.model.AlgorithmType;
import com.ledgerwise.anomaly.model.AnomalyDetectionRequest;
import com.ledgerwise.anomaly.model.AnomalyDetectionResult;
import com.ledgerwise.anomaly.model.AnomalyType;
import com.ledgerwise.anomaly.model.DataSource;
import com.ledgerwise.anomaly.model.DataSourceType;
import com.ledgerwise.anomaly.model.DataValidationReport;
import com.ledgerwise.anomaly.model.DetectionCapabilities;
import com.ledgerwise.anomaly.model.DetectionRecommendation;
import com.ledgerwise.anomaly.model.DetectionSummary;
import com.ledgerwise.anomaly.model.GeneratedAlert;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.ModelPerformance;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.ProcessorStatus;
import com.ledgerwise.anomaly.model.Sensitivity;
import com.ledgerwise.anomaly.repository.DetectionResultRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the engine: one-shot detection, real-time processor control, validation,
 * history lookups and alert acknowledgement.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DataPreparationService preparationService;
    private final DataValidationService validationService;
    private final BaselineService baselineService;
    private final DetectionPipeline pipeline;
    private final DetectionSummaryService summaryService;
    private final RecommendationService recommendationService;
    private final ModelPerformanceService performanceService;
    private final AlertLifecycleService alertLifecycleService;
    private final DetectionResultRepository resultRepository;
    private final DetectorRegistry detectorRegistry;
    private final DetectionThresholdConfig thresholdConfig;
    private final EnrichmentConfig enrichmentConfig;
    private final MetricsConfig metricsConfig;

    // processorId -> running processor
    private final ConcurrentHashMap<String, StreamProcessor> processors = new ConcurrentHashMap<>();

    public AnomalyDetectionService(DataPreparationService preparationService,
                                   DataValidationService validationService,
                                   BaselineService baselineService,
                                   DetectionPipeline pipeline,
                                   DetectionSummaryService summaryService,
                                   RecommendationService recommendationService,
                                   ModelPerformanceService performanceService,
                                   AlertLifecycleService alertLifecycleService,
                                   DetectionResultRepository resultRepository,
                                   DetectorRegistry detectorRegistry,
                                   DetectionThresholdConfig thresholdConfig,
                                   EnrichmentConfig enrichmentConfig,
                                   MetricsConfig metricsConfig) {
        this.preparationService = preparationService;
        this.validationService = validationService;
        this.baselineService = baselineService;
        this.pipeline = pipeline;
        this.summaryService = summaryService;
        this.recommendationService = recommendationService;
        this.performanceService = performanceService;
        this.alertLifecycleService = alertLifecycleService;
        this.resultRepository = resultRepository;
        this.detectorRegistry = detectorRegistry;
        this.thresholdConfig = thresholdConfig;
        this.enrichmentConfig = enrichmentConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run the full pipeline over the request's data.
     *
     * @throws InvalidDetectionRequestException when the request has no data, no algorithms,
     *         no alert configuration or no value fields
     */
    @Observed(name = "detection.detect", contextualName = "detect-anomalies")
    public AnomalyDetectionResult detect(AnomalyDetectionRequest request) {
        validate(request);
        long start = System.currentTimeMillis();
        String requestId = request.getId() != null ? request.getId() : "req_" + UUID.randomUUID();
        String organizationId = String.valueOf(request.getOrganizationId());
        String sourceId = String.valueOf(request.getDataSource().getSourceId());

        PreparedBatch batch = preparationService.prepare(request.getDataSource());
        HistoricalBaseline baseline = baselineService.getOrCreate(organizationId, sourceId, batch);

        PipelineResult run = pipeline.run(batch, baseline, request.getDetectionConfig(),
                request.getAlertConfig(), request.getContext(), requestId, organizationId, sourceId);

        long processingTime = System.currentTimeMillis() - start;
        DetectionSummary summary = summaryService.summarize(run.getAnomalies(), batch,
                run.getAlerts().size(), processingTime);
        List<DetectionRecommendation> recommendations = recommendationService.recommend(
                run.getAnomalies(), run.getStatus(), baseline.getSampleCount(), run.getMinimumSamples());
        ModelPerformance performance = performanceService.evaluate(run.getOutcomes(), run.getAnomalies(),
                run.isEnsembleApplied());

        AnomalyDetectionResult result = AnomalyDetectionResult.builder()
                .requestId(requestId)
                .organizationId(organizationId)
                .sourceId(sourceId)
                .status(run.getStatus())
                .detectionTimestamp(System.currentTimeMillis())
                .anomalies(run.getAnomalies())
                .summary(summary)
                .recommendations(recommendations)
                .modelPerformance(performance)
                .alerts(run.getAlerts())
                .processingTimeMs(processingTime)
                .build();

        resultRepository.save(result);
        metricsConfig.recordDetection(run.getStatus().name(), run.getAnomalies().size(), processingTime);
        log.info("Detection {} for {}:{} finished: status={}, records={}, anomalies={}, alerts={}, {} ms",
                requestId, organizationId, sourceId, run.getStatus(), batch.size(),
                run.getAnomalies().size(), run.getAlerts().size(), processingTime);
        return result;
    }

    /**
     * Create and start a stream processor seeded with the request's data as its baseline.
     *
     * @return the new processor's id
     */
    public String startRealTimeDetection(AnomalyDetectionRequest request) {
        validate(request);
        String processorId = "proc_" + UUID.randomUUID();
        StreamProcessor processor = new StreamProcessor(processorId, request, preparationService,
                baselineService, pipeline, metricsConfig, thresholdConfig.getStream().getMaxQueuedBatches());
        processor.start();
        processors.put(processorId, processor);
        metricsConfig.updateActiveProcessorCount(processors.size());
        return processorId;
    }

    /**
     * Stop and forget a processor. Unknown ids are ignored.
     */
    public void stopRealTimeDetection(String processorId) {
        StreamProcessor processor = processors.remove(processorId);
        if (processor == null) {
            log.debug("Stop requested for unknown processor {}", processorId);
            return;
        }
        processor.stop();
        metricsConfig.updateActiveProcessorCount(processors.size());
    }

    public ProcessorStatus getDetectionStatus(String processorId) {
        StreamProcessor processor = processors.get(processorId);
        return processor == null ? null : processor.getStatus();
    }

    public StreamProcessor getProcessor(String processorId) {
        return processors.get(processorId);
    }

    public DataValidationReport validateData(DataSource dataSource) {
        return validationService.validate(dataSource);
    }

    public List<AnomalyDetectionResult> getDetectionHistory(String organizationId, String sourceId, int limit) {
        return resultRepository.findBySource(organizationId, sourceId, limit);
    }

    public AnomalyDetectionResult getDetectionResult(String requestId) {
        return resultRepository.findByRequestId(requestId);
    }

    public DetectionCapabilities getDetectionCapabilities() {
        List<AlgorithmType> algorithms = new ArrayList<>(detectorRegistry.getRegisteredAlgorithms());
        return DetectionCapabilities.builder()
                .algorithms(algorithms)
                .dataSourceTypes(new ArrayList<>(Arrays.asList(DataSourceType.values())))
                .anomalyTypes(new ArrayList<>(Arrays.asList(AnomalyType.values())))
                .sensitivityLevels(new ArrayList<>(Arrays.asList(Sensitivity.values())))
                .alertChannels(new ArrayList<>(Arrays.asList(AlertChannelType.values())))
                .realTimeProcessing(true)
                .textEnrichment(enrichmentConfig.isEnabled())
                .modelVersion(thresholdConfig.getModelVersion())
                .build();
    }

    public GeneratedAlert getAlert(String alertId) {
        return alertLifecycleService.getAlert(alertId);
    }

    public GeneratedAlert acknowledgeAlert(String alertId, String acknowledgedBy) {
        return alertLifecycleService.acknowledge(alertId, acknowledgedBy, System.currentTimeMillis());
    }

    public GeneratedAlert resolveAlert(String alertId) {
        return alertLifecycleService.resolve(alertId, System.currentTimeMillis());
    }

    @PreDestroy
    public void shutdown() {
        for (String processorId : new ArrayList<>(processors.keySet())) {
            stopRealTimeDetection(processorId);
        }
    }

    private void validate(AnomalyDetectionRequest request) {
        if (request == null) {
            throw new InvalidDetectionRequestException("Detection request is required");
        }
        DataSource dataSource = request.getDataSource();
        if (dataSource == null || dataSource.getData() == null || dataSource.getData().isEmpty()) {
            throw new InvalidDetectionRequestException("Data source must contain at least one record");
        }
        if (request.getDetectionConfig() == null || request.getDetectionConfig().getAlgorithms() == null
                || request.getDetectionConfig().getAlgorithms().isEmpty()) {
            throw new InvalidDetectionRequestException("At least one detection algorithm must be configured");
        }
        if (request.getAlertConfig() == null) {
            throw new InvalidDetectionRequestException("Alert configuration is required");
        }
        if (dataSource.getMetadata() == null || dataSource.getMetadata().getValueFields() == null
                || dataSource.getMetadata().getValueFields().isEmpty()) {
            throw new InvalidDetectionRequestException("Data source metadata must declare at least one value field");
        }
    }
}
