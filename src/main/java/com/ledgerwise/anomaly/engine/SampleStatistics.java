package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.BaselineMetric;

import java.util.List;
import java.util.Map;

/**
 * Descriptive statistics shared by the baseline builder and the detectors.
 */
public final class SampleStatistics {

    public static final int[] PERCENTILES = {25, 50, 75, 90, 95, 99};

    private SampleStatistics() {}

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Population standard deviation. Constant or single-value samples yield exactly 0.
     */
    public static double populationStd(double[] values, double mean) {
        if (values.length < 2) return 0.0;
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        double std = Math.sqrt(sumSq / values.length);
        // guards against rounding noise on constant samples
        return std < 1e-12 * Math.max(1.0, Math.abs(mean)) ? 0.0 : std;
    }

    /**
     * Nearest-rank percentile over an ascending array: index floor(p/100 * n), clamped to n-1.
     */
    public static double percentile(double[] sortedAscending, int p) {
        if (sortedAscending.length == 0) return 0.0;
        int idx = (int) Math.floor(p / 100.0 * sortedAscending.length);
        return sortedAscending[Math.min(idx, sortedAscending.length - 1)];
    }

    public static double zScore(double value, double mean, double std) {
        return std == 0.0 ? 0.0 : (value - mean) / std;
    }

    /**
     * Probability of observing a deviation at least as large as |z| under a normal distribution.
     */
    public static double twoSidedTailProbability(double z) {
        return erfc(Math.abs(z) / Math.sqrt(2.0));
    }

    /**
     * Complementary error function, Abramowitz and Stegun 7.1.26 (max error 1.5e-7).
     */
    static double erfc(double x) {
        if (x < 0) return 2.0 - erfc(-x);
        double t = 1.0 / (1.0 + 0.3275911 * x);
        double poly = t * (0.254829592 + t * (-0.284496736 + t * (1.421413741
                + t * (-1.453152027 + t * 1.061405429))));
        return poly * Math.exp(-x * x);
    }

    /**
     * Approximate percentile rank (0-100) of a value, interpolating linearly between the
     * baseline's stored percentiles with min and max as the 0th and 100th.
     */
    public static double percentileRank(double value, BaselineMetric metric) {
        if (value <= metric.getMin()) return 0.0;
        if (value >= metric.getMax()) return 100.0;

        Map<String, Double> stored = metric.getPercentiles();
        double prevRank = 0.0;
        double prevValue = metric.getMin();
        for (int p : PERCENTILES) {
            Double pv = stored.get("p" + p);
            if (pv == null) continue;
            if (value <= pv) {
                return interpolate(value, prevValue, pv, prevRank, p);
            }
            prevRank = p;
            prevValue = pv;
        }
        return interpolate(value, prevValue, metric.getMax(), prevRank, 100.0);
    }

    private static double interpolate(double value, double loValue, double hiValue, double loRank, double hiRank) {
        if (hiValue <= loValue) return hiRank;
        return loRank + (value - loValue) / (hiValue - loValue) * (hiRank - loRank);
    }

    public static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }
}
