package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.client.TextGenerationClient;
import com.ledgerwise.anomaly.config.EnrichmentConfig;
import com.ledgerwise.anomaly.config.MetricsConfig;
import com.ledgerwise.anomaly.exception.TextGenerationException;
import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyEnrichmentServiceTest {

    @Mock private TextGenerationClient textClient;
    private EnrichmentConfig config;
    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private AnomalyEnrichmentService enrichmentService;

    @BeforeEach
    void setUp() {
        config = new EnrichmentConfig();
        config.setEnabled(true);
        executor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        enrichmentService = new AnomalyEnrichmentService(new BusinessImpactAssessor(), textClient, config,
                executor, new MetricsConfig(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void enrich_disabled_setsImpactOnly() {
        config.setEnabled(false);
        DetectedAnomaly anomaly = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);

        enrichmentService.enrich(new ArrayList<>(List.of(anomaly)),
                TestDataFactory.detectionContext(UserRole.MANAGER), "req-1");

        assertThat(anomaly.getBusinessImpact().getCategory()).isEqualTo(ImpactCategory.FINANCIAL);
        assertThat(anomaly.getExplanation().getPossibleReasons()).isEmpty();
        verify(textClient, never()).generate(any());
    }

    @Test
    void enrich_appendsParsedReasonsAndFactors() {
        when(textClient.generate(any())).thenReturn("""
                Possible reasons:
                - Duplicate invoice
                Contributing factors:
                - Month-end rush
                """);
        DetectedAnomaly anomaly = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);

        enrichmentService.enrich(new ArrayList<>(List.of(anomaly)),
                TestDataFactory.detectionContext(UserRole.MANAGER), "req-2");

        assertThat(anomaly.getExplanation().getPossibleReasons()).containsExactly("Duplicate invoice");
        assertThat(anomaly.getExplanation().getContributingFactors())
                .containsExactly("Z-score above threshold", "Month-end rush");
        assertThat(anomaly.getExplanation().getPrimaryCause()).isEqualTo("amount far from baseline");
    }

    @Test
    void enrich_failedCall_keepsExplanationAndCountsFailure() {
        when(textClient.generate(any())).thenThrow(new TextGenerationException("boom"));
        DetectedAnomaly anomaly = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);

        enrichmentService.enrich(new ArrayList<>(List.of(anomaly)), null, "req-3");

        assertThat(anomaly.getExplanation().getPossibleReasons()).isEmpty();
        assertThat(anomaly.getExplanation().getContributingFactors()).containsExactly("Z-score above threshold");
        assertThat(meterRegistry.get("enrichment.failure.count").tag("reason", "error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void enrich_slowCall_timesOutWithinDeadline() {
        when(textClient.generate(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "- too late";
        });
        DetectionContext context = TestDataFactory.detectionContext(UserRole.ASSOCIATE);
        context.setEnrichmentTimeoutMs(100L);
        DetectedAnomaly anomaly = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);

        long start = System.currentTimeMillis();
        enrichmentService.enrich(new ArrayList<>(List.of(anomaly)), context, "req-4");
        long elapsed = System.currentTimeMillis() - start;

        assertThat(elapsed).isLessThan(2_000);
        assertThat(anomaly.getExplanation().getPossibleReasons()).isEmpty();
        assertThat(meterRegistry.get("enrichment.failure.count").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void enrich_limitsCallsToTopScoringAnomalies() {
        config.setMaxEnrichedAnomalies(2);
        when(textClient.generate(any())).thenReturn("- reason");
        DetectedAnomaly low = TestDataFactory.anomaly("amount", Severity.LOW, 2.6, 1L);
        DetectedAnomaly mid = TestDataFactory.anomaly("amount", Severity.MEDIUM, 3.2, 2L);
        DetectedAnomaly top = TestDataFactory.anomaly("amount", Severity.CRITICAL, 9.0, 3L);

        enrichmentService.enrich(new ArrayList<>(List.of(low, mid, top)), null, "req-5");

        verify(textClient, times(2)).generate(any());
        assertThat(low.getExplanation().getPossibleReasons()).isEmpty();
        assertThat(top.getExplanation().getPossibleReasons()).containsExactly("reason");
        assertThat(low.getBusinessImpact()).isNotNull();
    }

    @Test
    void resolveTimeoutMs_prefersCallerTimeout() {
        DetectionContext context = TestDataFactory.detectionContext(UserRole.ASSOCIATE);

        assertThat(enrichmentService.resolveTimeoutMs(context)).isEqualTo(5_000L);
        context.setEnrichmentTimeoutMs(250L);
        assertThat(enrichmentService.resolveTimeoutMs(context)).isEqualTo(250L);
    }
}
