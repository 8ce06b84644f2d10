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
public class PreparedBatch {

    @Builder.Default
    private List<PreparedRecord> records = new ArrayList<>();

    @Builder.Default
    private List<String> valueFields = new ArrayList<>();

    @Builder.Default
    private List<String> categoricalFields = new ArrayList<>();

    private int submittedRecords;

    private int droppedRecords;

    private int filledValues;

    private int missingTimestamps;

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
