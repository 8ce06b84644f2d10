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
public class DetectionRecommendation {

    private RecommendationType type;

    private RecommendationPriority priority;

    private String title;

    private String description;

    @Builder.Default
    private List<String> actionSteps = new ArrayList<>();

    private String expectedOutcome;

    @Builder.Default
    private List<String> resources = new ArrayList<>();

    // free text, e.g. "Immediate (within 1 hour)"
    private String timeline;

    @Builder.Default
    private List<String> successCriteria = new ArrayList<>();

    @Builder.Default
    private List<String> relatedAnomalyIds = new ArrayList<>();
}
