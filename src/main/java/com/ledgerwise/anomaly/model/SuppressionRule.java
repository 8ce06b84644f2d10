package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuppressionRule {

    private String condition;

    // window length, e.g. "30m", "2h", "1d"
    private String duration;

    private int maxOccurrences;
}
