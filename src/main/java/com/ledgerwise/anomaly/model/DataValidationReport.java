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
public class DataValidationReport {

    private int totalRecords;

    private int validRecords;

    private int invalidRecords;

    private boolean validationPassed;

    // validRecords / totalRecords, weighted by the declared quality score
    private double dataQualityScore;

    @Builder.Default
    private List<RecordValidationIssue> recordIssues = new ArrayList<>();
}
