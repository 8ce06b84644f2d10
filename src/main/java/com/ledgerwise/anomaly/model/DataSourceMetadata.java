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
public class DataSourceMetadata {

    // field name -> declared data type
    @Builder.Default
    private Map<String, String> schema = new HashMap<>();

    private String primaryKey;

    private String timestampField;

    @Builder.Default
    private List<String> valueFields = new ArrayList<>();

    @Builder.Default
    private List<String> categoricalFields = new ArrayList<>();

    private ExpectedFrequency expectedFrequency;

    @Builder.Default
    private double qualityScore = 1.0;
}
