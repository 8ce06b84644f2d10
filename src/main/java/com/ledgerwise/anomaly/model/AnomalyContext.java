package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyContext {

    @Builder.Default
    private Map<String, Object> dataPoint = new HashMap<>();

    @Builder.Default
    private List<Map<String, Object>> surroundingData = new ArrayList<>();

    private TimeRange timeWindow;

    @Builder.Default
    private List<String> relatedEntities = new ArrayList<>();

    @Builder.Default
    private List<String> contextualFactors = new ArrayList<>();
}
