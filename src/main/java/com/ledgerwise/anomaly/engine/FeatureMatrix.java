package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;

import java.util.List;

/**
 * Row-per-record view of a prepared batch's normalized value fields, in declared field order.
 */
public final class FeatureMatrix {

    private final List<String> featureNames;
    private final double[][] rows;

    private FeatureMatrix(List<String> featureNames, double[][] rows) {
        this.featureNames = featureNames;
        this.rows = rows;
    }

    public static FeatureMatrix normalized(PreparedBatch batch) {
        List<String> fields = List.copyOf(batch.getValueFields());
        List<PreparedRecord> records = batch.getRecords();
        double[][] rows = new double[records.size()][fields.size()];
        for (int r = 0; r < records.size(); r++) {
            PreparedRecord record = records.get(r);
            for (int f = 0; f < fields.size(); f++) {
                Double v = record.getNormalized().get(fields.get(f));
                rows[r][f] = v == null ? 0.0 : v;
            }
        }
        return new FeatureMatrix(fields, rows);
    }

    public double[] columnMeans() {
        double[] means = new double[featureNames.size()];
        if (rows.length == 0) return means;
        for (double[] row : rows) {
            for (int f = 0; f < means.length; f++) means[f] += row[f];
        }
        for (int f = 0; f < means.length; f++) means[f] /= rows.length;
        return means;
    }

    /**
     * Scale raw non-negative weights to sum to 1; equal shares when they are all zero.
     */
    public static double[] normalizeShares(double[] weights) {
        double total = 0.0;
        for (double w : weights) total += Math.max(0.0, w);
        double[] shares = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            shares[i] = total > 0 ? Math.max(0.0, weights[i]) / total : 1.0 / weights.length;
        }
        return shares;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public double[][] rows() {
        return rows;
    }

    public int featureCount() {
        return featureNames.size();
    }

    public int rowCount() {
        return rows.length;
    }
}
