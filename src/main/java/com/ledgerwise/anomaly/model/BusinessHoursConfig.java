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
public class BusinessHoursConfig {

    @Builder.Default
    private String timezone = "UTC";

    @Builder.Default
    private WorkingHours workingHours = new WorkingHours();

    // 0 = Sunday .. 6 = Saturday
    @Builder.Default
    private List<Integer> workingDays = new ArrayList<>(List.of(1, 2, 3, 4, 5));

    // ISO dates (yyyy-MM-dd)
    @Builder.Default
    private List<String> holidays = new ArrayList<>();
}
