package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.AnomalyContext;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import com.ledgerwise.anomaly.model.TimeRange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the context block attached to an anomaly from the records around it.
 */
public final class AnomalyContexts {

    private AnomalyContexts() {}

    public static AnomalyContext around(PreparedBatch batch, int recordIndex, int window) {
        List<PreparedRecord> records = batch.getRecords();
        PreparedRecord record = records.get(recordIndex);

        int from = Math.max(0, recordIndex - window);
        int to = Math.min(records.size() - 1, recordIndex + window);

        List<Map<String, Object>> surrounding = new ArrayList<>();
        Long windowStart = null;
        Long windowEnd = null;
        for (int i = from; i <= to; i++) {
            PreparedRecord neighbour = records.get(i);
            Long ts = neighbour.getTimestamp();
            if (ts != null) {
                windowStart = windowStart == null ? ts : Math.min(windowStart, ts);
                windowEnd = windowEnd == null ? ts : Math.max(windowEnd, ts);
            }
            if (i != recordIndex) {
                surrounding.add(new HashMap<>(neighbour.getRaw()));
            }
        }

        List<String> related = new ArrayList<>();
        for (String field : batch.getCategoricalFields()) {
            Object value = record.getRaw().get(field);
            if (value != null) {
                related.add(field + "=" + value);
            }
        }

        List<String> factors = new ArrayList<>();
        factors.add("Position " + (recordIndex + 1) + " of " + records.size() + " records");
        if (record.getTimestamp() == null) {
            factors.add("Record has no usable timestamp");
        }

        return AnomalyContext.builder()
                .dataPoint(new HashMap<>(record.getRaw()))
                .surroundingData(surrounding)
                .timeWindow(windowStart == null ? null : new TimeRange(windowStart, windowEnd))
                .relatedEntities(related)
                .contextualFactors(factors)
                .build();
    }
}
