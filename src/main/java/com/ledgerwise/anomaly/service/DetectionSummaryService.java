package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.model.AnomalyType;
import com.ledgerwise.anomaly.model.DetectedAnomaly;
import com.ledgerwise.anomaly.model.DetectionSummary;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import com.ledgerwise.anomaly.model.Severity;
import com.ledgerwise.anomaly.model.TimeRange;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class DetectionSummaryService {

    public DetectionSummary summarize(List<DetectedAnomaly> anomalies, PreparedBatch batch,
                                      int alertsGenerated, long processingTimeMs) {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
        for (DetectedAnomaly anomaly : anomalies) {
            if (anomaly.getSeverity() != null) bySeverity.merge(anomaly.getSeverity(), 1, Integer::sum);
            if (anomaly.getType() != null) byType.merge(anomaly.getType(), 1, Integer::sum);
        }

        Long start = null;
        Long end = null;
        for (PreparedRecord record : batch.getRecords()) {
            Long ts = record.getTimestamp();
            if (ts == null) continue;
            start = start == null ? ts : Math.min(start, ts);
            end = end == null ? ts : Math.max(end, ts);
        }

        List<String> issues = new ArrayList<>();
        if (batch.getDroppedRecords() > 0) {
            issues.add(batch.getDroppedRecords() + " records were not objects and were dropped");
        }
        if (batch.getFilledValues() > 0) {
            issues.add(batch.getFilledValues() + " missing or non-numeric values were filled with 0");
        }
        if (batch.getMissingTimestamps() > 0) {
            issues.add(batch.getMissingTimestamps() + " records have no usable timestamp");
        }

        double coverage = batch.getSubmittedRecords() == 0
                ? 0.0
                : (double) batch.size() / batch.getSubmittedRecords();

        return DetectionSummary.builder()
                .totalAnomalies(anomalies.size())
                .severityBreakdown(bySeverity)
                .typeBreakdown(byType)
                .timeRange(start == null ? null : new TimeRange(start, end))
                .recordsAnalyzed(batch.size())
                .dataCoverage(coverage)
                .dataQualityIssues(issues)
                .processingTimeMs(processingTimeMs)
                .alertsGenerated(alertsGenerated)
                .build();
    }
}
