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
public class EscalationRule {

    private String condition;

    private long delayMinutes;

    @Builder.Default
    private List<String> escalateTo = new ArrayList<>();

    @Builder.Default
    private int maxEscalations = 1;
}
