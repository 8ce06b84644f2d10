package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionCapabilities {

    @Builder.Default
    private List<AlgorithmType> algorithms = new ArrayList<>();

    @Builder.Default
    private List<DataSourceType> dataSourceTypes = new ArrayList<>();

    @Builder.Default
    private List<AnomalyType> anomalyTypes = new ArrayList<>();

    @Builder.Default
    private List<Sensitivity> sensitivityLevels = new ArrayList<>();

    @Builder.Default
    private List<AlertChannelType> alertChannels = new ArrayList<>();

    private boolean realTimeProcessing;

    private boolean textEnrichment;

    private String modelVersion;
}
