package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record after preparation: numeric value fields filled, normalized against the batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreparedRecord {

    private int index;

    private Long timestamp;

    // copy of the original record
    private Map<String, Object> raw;

    @Builder.Default
    private Map<String, Double> values = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> normalized = new LinkedHashMap<>();
}
