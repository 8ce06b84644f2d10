package com.ledgerwise.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded isolation forest. Training with the same data, parameters and seed always yields the
 * same forest, so scoring a batch twice gives identical results.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Train a forest on the given rows.
     *
     * @param data       training rows, one feature vector each
     * @param numTrees   number of trees (typically 100)
     * @param sampleSize sub-sample drawn per tree (typically 256), capped at the row count
     * @param seed       random seed
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            return new IsolationForest(Collections.emptyList(), 0);
        }
        int effectiveSample = Math.max(1, Math.min(sampleSize, data.length));
        int maxDepth = (int) Math.ceil(Math.log(Math.max(2, effectiveSample)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.build(subsample(data, effectiveSample, random), maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSample);
    }

    /**
     * Anomaly score s(x, n) = 2^(-E(h(x)) / c(n)), between 0 (normal) and 1 (anomalous).
     * Around 0.5 means the point is no easier to isolate than any other.
     */
    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        double avgPath = 0.0;
        for (IsolationTree tree : trees) {
            avgPath += tree.pathLength(point);
        }
        avgPath /= trees.size();
        return Math.pow(2.0, -avgPath / c);
    }

    /**
     * Per-feature score drop when that feature is replaced by its mean. Never negative.
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double base = score(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = featureMeans[i];
            contributions[i] = Math.max(0.0, base - score(modified));
        }
        return contributions;
    }

    public int size() {
        return trees.size();
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
