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
public class BusinessImpact {

    private ImpactCategory category;

    private ImpactLevel estimatedImpact;

    // absolute deviation summed over financial fields; null when not financial
    private Double potentialLoss;

    @Builder.Default
    private List<String> affectedProcesses = new ArrayList<>();

    @Builder.Default
    private List<String> stakeholders = new ArrayList<>();

    private Urgency urgency;
}
