package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A batch of raw records plus the metadata describing how to read them.
 * Records are expected to be {@code Map<String, Object>}; anything else is dropped
 * during preparation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSource {

    private DataSourceType type;

    private String sourceId;

    @Builder.Default
    private List<Object> data = new ArrayList<>();

    private DataSourceMetadata metadata;

    // Optional declared window of the data; derived from record timestamps when absent
    private TimeRange timeRange;

    private Double samplingRate;
}
