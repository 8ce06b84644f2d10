package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.engine.RecordValues;
import com.ledgerwise.anomaly.engine.SampleStatistics;
import com.ledgerwise.anomaly.exception.InvalidDetectionRequestException;
import com.ledgerwise.anomaly.model.DataSource;
import com.ledgerwise.anomaly.model.DataSourceMetadata;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw records into a {@link PreparedBatch}: non-object entries dropped, records sorted
 * by timestamp (records without one last, in submission order), missing or non-numeric
 * value fields filled with 0, and each value field normalized against the batch.
 * The input data source is never modified.
 */
@Service
public class DataPreparationService {

    private static final Logger log = LoggerFactory.getLogger(DataPreparationService.class);

    public PreparedBatch prepare(DataSource dataSource) {
        List<Object> data = dataSource == null ? null : dataSource.getData();
        if (data == null || data.isEmpty()) {
            throw new InvalidDetectionRequestException("Data source must contain at least one record");
        }
        DataSourceMetadata metadata = dataSource.getMetadata();
        if (metadata == null || metadata.getValueFields() == null || metadata.getValueFields().isEmpty()) {
            throw new InvalidDetectionRequestException("Data source metadata must declare at least one value field");
        }
        return prepare(data, metadata);
    }

    public PreparedBatch prepare(List<?> data, DataSourceMetadata metadata) {
        List<String> valueFields = List.copyOf(metadata.getValueFields());
        String timestampField = metadata.getTimestampField();

        List<PreparedRecord> records = new ArrayList<>(data.size());
        int dropped = 0;
        int missingTimestamps = 0;
        int filled = 0;

        for (Object entry : data) {
            if (!(entry instanceof Map<?, ?> map)) {
                dropped++;
                continue;
            }
            Map<String, Object> raw = copyOf(map);

            Long timestamp = timestampField == null ? null : RecordValues.parseTimestamp(raw.get(timestampField));
            if (timestamp == null) missingTimestamps++;

            Map<String, Double> values = new LinkedHashMap<>();
            for (String field : valueFields) {
                Double value = RecordValues.parseNumber(raw.get(field));
                if (value == null) {
                    value = 0.0;
                    filled++;
                }
                values.put(field, value);
            }

            records.add(PreparedRecord.builder()
                    .timestamp(timestamp)
                    .raw(raw)
                    .values(values)
                    .build());
        }

        // List.sort is stable: equal or missing timestamps keep submission order
        records.sort(Comparator.comparing(PreparedRecord::getTimestamp,
                Comparator.nullsLast(Comparator.naturalOrder())));
        for (int i = 0; i < records.size(); i++) {
            records.get(i).setIndex(i);
        }

        normalize(records, valueFields);

        if (dropped > 0 || filled > 0) {
            log.debug("Prepared {} records: dropped={}, filledValues={}, missingTimestamps={}",
                    records.size(), dropped, filled, missingTimestamps);
        }

        return PreparedBatch.builder()
                .records(records)
                .valueFields(new ArrayList<>(valueFields))
                .categoricalFields(metadata.getCategoricalFields() == null
                        ? new ArrayList<>() : new ArrayList<>(metadata.getCategoricalFields()))
                .submittedRecords(data.size())
                .droppedRecords(dropped)
                .filledValues(filled)
                .missingTimestamps(missingTimestamps)
                .build();
    }

    private void normalize(List<PreparedRecord> records, List<String> valueFields) {
        for (String field : valueFields) {
            double[] column = new double[records.size()];
            for (int i = 0; i < column.length; i++) {
                column[i] = records.get(i).getValues().get(field);
            }
            double mean = SampleStatistics.mean(column);
            double std = SampleStatistics.populationStd(column, mean);
            for (int i = 0; i < column.length; i++) {
                records.get(i).getNormalized().put(field, SampleStatistics.zScore(column[i], mean, std));
            }
        }
    }

    private static Map<String, Object> copyOf(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() != null) {
                copy.put(e.getKey().toString(), e.getValue());
            }
        }
        return copy;
    }
}
