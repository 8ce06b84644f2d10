package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionSummaryServiceTest {

    private final DetectionSummaryService summaryService = new DetectionSummaryService();

    private static PreparedRecord prepared(int index, Long timestamp) {
        return PreparedRecord.builder().index(index).timestamp(timestamp).build();
    }

    @Test
    void summarize_countsBreakdownsAndTimeRange() {
        PreparedBatch batch = PreparedBatch.builder()
                .records(new ArrayList<>(List.of(prepared(0, 300L), prepared(1, null), prepared(2, 100L))))
                .submittedRecords(4)
                .droppedRecords(1)
                .filledValues(2)
                .missingTimestamps(1)
                .build();
        List<DetectedAnomaly> anomalies = List.of(
                TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 100L),
                TestDataFactory.anomaly("fee", Severity.HIGH, 4.5, 300L),
                TestDataFactory.anomaly("fee", Severity.LOW, 2.1, 300L));

        DetectionSummary summary = summaryService.summarize(anomalies, batch, 2, 42);

        assertThat(summary.getTotalAnomalies()).isEqualTo(3);
        assertThat(summary.getSeverityBreakdown()).containsEntry(Severity.HIGH, 2).containsEntry(Severity.LOW, 1);
        assertThat(summary.getTypeBreakdown()).containsEntry(AnomalyType.POINT, 3);
        assertThat(summary.getTimeRange()).isEqualTo(new TimeRange(100L, 300L));
        assertThat(summary.getRecordsAnalyzed()).isEqualTo(3);
        assertThat(summary.getDataCoverage()).isEqualTo(0.75);
        assertThat(summary.getDataQualityIssues()).hasSize(3);
        assertThat(summary.getProcessingTimeMs()).isEqualTo(42);
        assertThat(summary.getAlertsGenerated()).isEqualTo(2);
    }

    @Test
    void summarize_noTimestampsOrSubmissions() {
        PreparedBatch batch = PreparedBatch.builder().build();

        DetectionSummary summary = summaryService.summarize(List.of(), batch, 0, 0);

        assertThat(summary.getTimeRange()).isNull();
        assertThat(summary.getDataCoverage()).isZero();
        assertThat(summary.getDataQualityIssues()).isEmpty();
    }
}
