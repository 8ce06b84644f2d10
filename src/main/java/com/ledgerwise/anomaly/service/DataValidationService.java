package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.engine.RecordValues;
import com.ledgerwise.anomaly.model.DataSource;
import com.ledgerwise.anomaly.model.DataSourceMetadata;
import com.ledgerwise.anomaly.model.DataValidationReport;
import com.ledgerwise.anomaly.model.RecordValidationIssue;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a data source record by record without running detection.
 * A record is valid when it is an object, has a parseable timestamp (when a timestamp field
 * is declared) and every declared value field is numeric.
 */
@Service
public class DataValidationService {

    public DataValidationReport validate(DataSource dataSource) {
        List<Object> data = dataSource == null || dataSource.getData() == null
                ? List.of() : dataSource.getData();
        DataSourceMetadata metadata = dataSource == null ? null : dataSource.getMetadata();
        List<String> valueFields = metadata == null || metadata.getValueFields() == null
                ? List.of() : metadata.getValueFields();
        String timestampField = metadata == null ? null : metadata.getTimestampField();

        List<RecordValidationIssue> issues = new ArrayList<>();
        int valid = 0;

        for (int i = 0; i < data.size(); i++) {
            List<String> problems = checkRecord(data.get(i), timestampField, valueFields);
            if (problems.isEmpty()) {
                valid++;
            } else {
                issues.add(RecordValidationIssue.builder().recordIndex(i).issues(problems).build());
            }
        }

        int total = data.size();
        double declaredQuality = metadata == null ? 1.0 : metadata.getQualityScore();
        double score = total == 0 ? 0.0 : ((double) valid / total) * declaredQuality;

        return DataValidationReport.builder()
                .totalRecords(total)
                .validRecords(valid)
                .invalidRecords(total - valid)
                .validationPassed(total > 0 && valid == total && !valueFields.isEmpty())
                .dataQualityScore(score)
                .recordIssues(issues)
                .build();
    }

    private List<String> checkRecord(Object entry, String timestampField, List<String> valueFields) {
        List<String> problems = new ArrayList<>();
        if (!(entry instanceof Map<?, ?> record)) {
            problems.add("Record is not an object");
            return problems;
        }
        if (timestampField != null && RecordValues.parseTimestamp(record.get(timestampField)) == null) {
            problems.add("Missing or invalid timestamp in field '" + timestampField + "'");
        }
        for (String field : valueFields) {
            Object value = record.get(field);
            if (value == null) {
                problems.add("Missing value field '" + field + "'");
            } else if (RecordValues.parseNumber(value) == null) {
                problems.add("Non-numeric value in field '" + field + "': " + value);
            }
        }
        return problems;
    }
}
