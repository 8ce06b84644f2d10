package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselinePattern {

    // e.g. "amount:hour_of_day"
    private String pattern;

    private int frequency;

    // share of variance explained by the cycle, 0-1
    private double strength;

    private long lastSeen;
}
