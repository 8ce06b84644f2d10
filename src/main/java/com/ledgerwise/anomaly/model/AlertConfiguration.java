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
public class AlertConfiguration {

    private SeverityConfiguration severity;

    @Builder.Default
    private List<AlertChannel> channels = new ArrayList<>();

    @Builder.Default
    private List<EscalationRule> escalation = new ArrayList<>();

    @Builder.Default
    private List<SuppressionRule> suppressionRules = new ArrayList<>();

    // null means alerts are delivered immediately
    private BusinessHoursConfig businessHours;
}
