package com.ledgerwise.anomaly.engine.oneclass;

import java.util.Arrays;

/**
 * Spherical support boundary: a centroid plus the radius that encloses all but roughly a
 * {@code nu} fraction of the training points.
 */
public final class SupportBoundary {

    private final double[] centroid;
    private final double radius;

    private SupportBoundary(double[] centroid, double radius) {
        this.centroid = centroid;
        this.radius = radius;
    }

    public static SupportBoundary fit(double[][] rows, double nu) {
        if (rows.length == 0) {
            return new SupportBoundary(new double[0], 0.0);
        }
        int dims = rows[0].length;
        double[] centroid = new double[dims];
        for (double[] row : rows) {
            for (int d = 0; d < dims; d++) centroid[d] += row[d];
        }
        for (int d = 0; d < dims; d++) centroid[d] /= rows.length;

        double[] distances = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            distances[i] = Math.sqrt(squaredDistance(rows[i], centroid));
        }
        Arrays.sort(distances);

        double clampedNu = Math.min(Math.max(nu, 0.0), 1.0);
        int idx = (int) Math.ceil((1.0 - clampedNu) * rows.length) - 1;
        idx = Math.max(0, Math.min(idx, rows.length - 1));
        return new SupportBoundary(centroid, distances[idx]);
    }

    public double distance(double[] point) {
        return Math.sqrt(squaredDistance(point, centroid));
    }

    /**
     * Each dimension's share of the squared distance to the centroid.
     */
    public double[] squaredDistanceTerms(double[] point) {
        double[] terms = new double[point.length];
        for (int d = 0; d < point.length; d++) {
            double diff = point[d] - centroid[d];
            terms[d] = diff * diff;
        }
        return terms;
    }

    public boolean isOutside(double[] point) {
        return radius > 0 && distance(point) > radius;
    }

    public double radius() {
        return radius;
    }

    public double[] centroid() {
        return centroid.clone();
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return sum;
    }
}
