package com.ledgerwise.anomaly.engine.isolationforest;

import java.util.Random;

public final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree build(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        int n = rows.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.external(n);
        }

        int feature = random.nextInt(rows[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        // constant along the chosen feature
        if (min >= max) {
            return IsolationNode.external(n);
        }

        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < split) leftCount++;
        }

        double[][] left = new double[leftCount][];
        double[][] right = new double[n - leftCount][];
        int li = 0;
        int ri = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }

        return IsolationNode.internal(feature, split,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
