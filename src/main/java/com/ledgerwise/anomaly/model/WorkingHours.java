package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkingHours {

    // HH:mm
    @Builder.Default
    private String start = "09:00";

    @Builder.Default
    private String end = "17:00";
}
