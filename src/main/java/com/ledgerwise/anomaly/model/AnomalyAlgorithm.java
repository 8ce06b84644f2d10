package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * One configured detection algorithm with its tuning parameters and ensemble weight (0-1).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyAlgorithm {

    private AlgorithmType type;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @Builder.Default
    private double weight = 1.0;

    public double getParamAsDouble(String key, double defaultValue) {
        Object val = parameters == null ? null : parameters.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Number number) return number.doubleValue();
        try {
            return Double.parseDouble(val.toString());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getParamAsLong(String key, long defaultValue) {
        Object val = parameters == null ? null : parameters.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Number number) return number.longValue();
        try {
            return Long.parseLong(val.toString());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
