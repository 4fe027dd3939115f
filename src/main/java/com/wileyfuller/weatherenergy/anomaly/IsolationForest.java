package com.wileyfuller.weatherenergy.anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008).
 * <p>
 * Each tree isolates a random sub-sample with random axis-aligned splits. Points that end up alone after
 * few splits get a short average path length and so a high anomaly score
 * {@code 2^(-E[h(x)] / c(psi))}. All randomness comes from one {@link Random} seeded at fit time.
 */
public class IsolationForest implements OutlierModel {

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_MAX_SAMPLES = 256;
    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int numTrees;
    private final int maxSamples;
    private final double contamination;
    private final long seed;

    private List<Node> trees;
    private int sampleSize;
    private double threshold;

    public IsolationForest(double contamination, long seed) {
        this(DEFAULT_TREES, DEFAULT_MAX_SAMPLES, contamination, seed);
    }

    public IsolationForest(int numTrees, int maxSamples, double contamination, long seed) {
        if (contamination <= 0 || contamination >= 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), was " + contamination);
        }
        this.numTrees = numTrees;
        this.maxSamples = maxSamples;
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public void fit(List<double[]> rows) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("cannot fit on zero rows");
        }
        double[][] data = rows.toArray(new double[0][]);
        Random random = new Random(seed);
        sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));

        trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            int[] sample = sampleWithoutReplacement(data.length, sampleSize, random);
            trees.add(build(data, sample, 0, heightLimit, random));
        }
        threshold = ContaminationThreshold.of(score(rows), contamination);
    }

    @Override
    public double[] score(List<double[]> rows) {
        if (trees == null) {
            throw new IllegalStateException("model is not fitted");
        }
        double norm = averagePathLength(sampleSize);
        double[] scores = new double[rows.size()];
        for (int i = 0; i < scores.length; i++) {
            double[] x = rows.get(i);
            double total = 0;
            for (Node tree : trees) {
                total += pathLength(x, tree, 0);
            }
            double mean = total / trees.size();
            // a single training row gives no path length to compare against
            scores[i] = norm > 0 ? Math.pow(2, -mean / norm) : 0.5;
        }
        return scores;
    }

    @Override
    public boolean[] labels(List<double[]> rows) {
        return ContaminationThreshold.above(score(rows), threshold);
    }

    double getThreshold() {
        return threshold;
    }

    private static int[] sampleWithoutReplacement(int n, int k, Random random) {
        int[] pool = new int[n];
        for (int i = 0; i < n; i++) {
            pool[i] = i;
        }
        // partial Fisher-Yates
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[k];
        System.arraycopy(pool, 0, sample, 0, k);
        return sample;
    }

    private static Node build(double[][] data, int[] idx, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || idx.length <= 1) {
            return Node.leaf(idx.length);
        }
        int features = data[idx[0]].length;
        List<Integer> splittable = new ArrayList<>(features);
        double[] min = new double[features];
        double[] max = new double[features];
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (int i : idx) {
                min[f] = Math.min(min[f], data[i][f]);
                max[f] = Math.max(max[f], data[i][f]);
            }
            if (max[f] > min[f]) {
                splittable.add(f);
            }
        }
        if (splittable.isEmpty()) {
            // all remaining points are identical
            return Node.leaf(idx.length);
        }
        int feature = splittable.get(random.nextInt(splittable.size()));
        double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (int i : idx) {
            if (data[i][feature] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[idx.length - leftCount];
        int l = 0;
        int r = 0;
        for (int i : idx) {
            if (data[i][feature] < split) {
                left[l++] = i;
            } else {
                right[r++] = i;
            }
        }
        return Node.split(feature, split,
                build(data, left, depth + 1, heightLimit, random),
                build(data, right, depth + 1, heightLimit, random));
    }

    private static double pathLength(double[] x, Node node, int depth) {
        while (!node.isLeaf()) {
            node = x[node.feature] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful binary search tree lookup over n points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
