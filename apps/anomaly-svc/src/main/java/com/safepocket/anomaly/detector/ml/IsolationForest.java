package com.safepocket.anomaly.detector.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over one-dimensional samples. Each tree isolates values with random
 * splits; values that isolate in fewer splits score closer to 1.0.
 */
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329d;

    private final List<Node> trees;
    private final int sampleSize;

    private IsolationForest(List<Node> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       training values
     * @param numTrees   number of trees in the forest
     * @param maxSamples sub-sampling size per tree, capped at {@code data.length}
     * @param seed       random seed; identical inputs always produce identical forests
     */
    public static IsolationForest fit(double[] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("cannot fit an isolation forest on an empty sample");
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be positive");
        }
        int sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);
        List<Node> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[] sample = subsample(data, sampleSize, random);
            trees.add(build(sample, 0, maxDepth, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    /**
     * Anomaly score {@code 2^(-E[h(x)] / c(sampleSize))} in (0, 1]. Above 0.5 leans anomalous.
     */
    public double anomalyScore(double value) {
        double averagePath = 0d;
        for (Node tree : trees) {
            averagePath += pathLength(tree, value, 0);
        }
        averagePath /= trees.size();
        double normalizer = averagePathLength(sampleSize);
        if (normalizer <= 0) {
            return 0.5d;
        }
        return Math.pow(2.0, -averagePath / normalizer);
    }

    public int size() {
        return trees.size();
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree of {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0d;
        }
        if (n == 2) {
            return 1d;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static double pathLength(Node node, double value, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        return value <= node.threshold
                ? pathLength(node.left, value, depth + 1)
                : pathLength(node.right, value, depth + 1);
    }

    private static Node build(double[] values, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || values.length <= 1) {
            return Node.leaf(values.length);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (min == max) {
            return Node.leaf(values.length);
        }
        double threshold = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double value : values) {
            if (value <= threshold) {
                leftCount++;
            }
        }
        double[] left = new double[leftCount];
        double[] right = new double[values.length - leftCount];
        int l = 0;
        int r = 0;
        for (double value : values) {
            if (value <= threshold) {
                left[l++] = value;
            } else {
                right[r++] = value;
            }
        }
        return Node.split(threshold,
                build(left, depth + 1, maxDepth, random),
                build(right, depth + 1, maxDepth, random));
    }

    private static double[] subsample(double[] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            indices[i] = i;
        }
        double[] sample = new double[size];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private static final class Node {
        private final double threshold;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(double threshold, Node left, Node right, int size) {
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node split(double threshold, Node left, Node right) {
            return new Node(threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
