package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference statistics for one (organization, data source). Replaced wholesale on refresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalBaseline {

    private TimeRange period;

    // keyed by field name
    @Builder.Default
    private Map<String, BaselineMetric> metrics = new LinkedHashMap<>();

    @Builder.Default
    private List<BaselinePattern> patterns = new ArrayList<>();

    private int sampleCount;

    private long lastUpdated;
}
