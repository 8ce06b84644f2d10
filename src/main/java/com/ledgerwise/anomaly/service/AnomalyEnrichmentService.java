package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.client.TextGenerationClient;
import com.ledgerwise.anomaly.client.TextGenerationRequest;
import com.ledgerwise.anomaly.client.TextGenerationResponseParser;
import com.ledgerwise.anomaly.config.EnrichmentConfig;
import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.model.AffectedField;
import com.ledgerwise.anomaly.model.AnomalyExplanation;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionContext;
import com.ledgerwise.anomaly.model.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Attaches business impact to every anomaly and, when enabled, appends reasons and factors
 * suggested by the text-generation service.
 *
 * Text calls for one batch run concurrently and share a single deadline: the caller's
 * timeout when given, the configured default otherwise. An anomaly whose call fails or
 * misses the deadline keeps its statistical explanation unchanged.
 */
@Service
public class AnomalyEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEnrichmentService.class);

    private final BusinessImpactAssessor impactAssessor;
    private final TextGenerationClient textClient;
    private final EnrichmentConfig config;
    private final ExecutorService enrichmentExecutor;
    private final MetricsConfig metricsConfig;

    public AnomalyEnrichmentService(BusinessImpactAssessor impactAssessor,
                                    TextGenerationClient textClient,
                                    EnrichmentConfig config,
                                    @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor,
                                    MetricsConfig metricsConfig) {
        this.impactAssessor = impactAssessor;
        this.textClient = textClient;
        this.config = config;
        this.enrichmentExecutor = enrichmentExecutor;
        this.metricsConfig = metricsConfig;
    }

    public void enrich(List<DetectedAnomaly> anomalies, DetectionContext context, String batchId) {
        for (DetectedAnomaly anomaly : anomalies) {
            anomaly.setBusinessImpact(impactAssessor.assess(anomaly, context));
        }

        if (!config.isEnabled() || anomalies.isEmpty()) {
            return;
        }

        List<DetectedAnomaly> selected = anomalies.stream()
                .sorted(Comparator.comparingDouble(DetectedAnomaly::getAnomalyScore).reversed())
                .limit(Math.max(0, config.getMaxEnrichedAnomalies()))
                .toList();

        long timeoutMs = resolveTimeoutMs(context);
        long deadline = System.currentTimeMillis() + timeoutMs;

        List<PendingCall> calls = new ArrayList<>(selected.size());
        for (DetectedAnomaly anomaly : selected) {
            TextGenerationRequest request = buildRequest(anomaly, context);
            calls.add(new PendingCall(anomaly,
                    CompletableFuture.supplyAsync(() -> textClient.generate(request), enrichmentExecutor)));
        }

        int enriched = 0;
        for (PendingCall call : calls) {
            DetectedAnomaly anomaly = call.anomaly();
            CompletableFuture<String> future = call.future();
            try {
                long remaining = Math.max(0L, deadline - System.currentTimeMillis());
                String answer = future.get(remaining, TimeUnit.MILLISECONDS);
                apply(anomaly, TextGenerationResponseParser.parse(answer, config.getMaxListItems()));
                enriched++;
            } catch (TimeoutException e) {
                future.cancel(true);
                metricsConfig.recordEnrichmentFailure("timeout");
                log.warn("Enrichment timed out after {} ms for anomaly {} in batch {}",
                        timeoutMs, anomaly.getId(), batchId);
            } catch (ExecutionException e) {
                metricsConfig.recordEnrichmentFailure("error");
                log.warn("Enrichment failed for anomaly {} in batch {}: {}",
                        anomaly.getId(), batchId, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                calls.forEach(c -> c.future().cancel(true));
                log.warn("Enrichment interrupted for batch {}", batchId);
                break;
            }
        }

        log.debug("Enriched {}/{} anomalies in batch {}", enriched, selected.size(), batchId);
    }

    long resolveTimeoutMs(DetectionContext context) {
        if (context != null && context.getEnrichmentTimeoutMs() != null && context.getEnrichmentTimeoutMs() > 0) {
            return context.getEnrichmentTimeoutMs();
        }
        return config.getDefaultTimeout().toMillis();
    }

    private void apply(DetectedAnomaly anomaly, TextGenerationResponseParser.Insights insights) {
        AnomalyExplanation explanation = anomaly.getExplanation();
        if (explanation == null) {
            explanation = new AnomalyExplanation();
            anomaly.setExplanation(explanation);
        }
        List<String> reasons = new ArrayList<>(explanation.getPossibleReasons());
        insights.reasons().stream().filter(r -> !reasons.contains(r)).forEach(reasons::add);
        List<String> factors = new ArrayList<>(explanation.getContributingFactors());
        insights.factors().stream().filter(f -> !factors.contains(f)).forEach(factors::add);
        explanation.setPossibleReasons(reasons);
        explanation.setContributingFactors(factors);
    }

    private TextGenerationRequest buildRequest(DetectedAnomaly anomaly, DetectionContext context) {
        UserRole role = context == null || context.getUserRole() == null ? UserRole.ASSOCIATE : context.getUserRole();
        String fields = anomaly.getAffectedFields().stream()
                .map(AffectedField::getFieldName)
                .collect(Collectors.joining(", "));
        String details = anomaly.getAffectedFields().stream()
                .map(f -> String.format("%s: expected %.2f, got %.2f", f.getFieldName(), f.getExpectedValue(), f.getActualValue()))
                .collect(Collectors.joining("; "));
        String impact = anomaly.getBusinessImpact() == null ? "UNKNOWN" : anomaly.getBusinessImpact().getCategory().name();

        String prompt = "Analyze this data anomaly in a professional-services finance context.\n\n"
                + "Anomaly details:\n"
                + "- Type: " + anomaly.getType() + "\n"
                + "- Severity: " + anomaly.getSeverity() + "\n"
                + "- Affected fields: " + details + "\n"
                + "- Business impact: " + impact + "\n"
                + "- User role: " + role + "\n\n"
                + "Reply with two bulleted lists under the headings 'Possible reasons:' and "
                + "'Contributing factors:' (at most " + config.getMaxListItems() + " items each).";

        String unit = context == null || context.getBusinessUnit() == null ? "operations" : context.getBusinessUnit();
        return TextGenerationRequest.builder()
                .prompt(prompt)
                .userRole(role.name())
                .businessContext("Anomaly analysis for " + unit + " (" + fields + ")")
                .build();
    }

    private record PendingCall(DetectedAnomaly anomaly, CompletableFuture<String> future) {}
}
