package com.hvac.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Random;

/**
 * One random partitioning tree. Grown by repeatedly partitioning an index range of the
 * training rows on a random feature at a random value between the range's min and max.
 */
public class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649;

    private final IsolationNode root;

    @JsonCreator
    public IsolationTree(@JsonProperty("root") IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree grow(double[][] rows, int heightLimit, Random random) {
        int[] order = new int[rows.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        return new IsolationTree(grow(rows, order, 0, order.length, 0, heightLimit, random));
    }

    private static IsolationNode grow(double[][] rows, int[] order, int from, int to,
                                      int height, int heightLimit, Random random) {
        int count = to - from;
        if (height >= heightLimit || count <= 1) {
            return IsolationNode.leaf(count);
        }

        int feature = random.nextInt(rows[order[from]].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double value = rows[order[i]][feature];
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        if (!(min < max)) {
            return IsolationNode.leaf(count);
        }

        double threshold = min + random.nextDouble() * (max - min);
        int mid = partition(rows, order, from, to, feature, threshold);
        return IsolationNode.split(feature, threshold,
                grow(rows, order, from, mid, height + 1, heightLimit, random),
                grow(rows, order, mid, to, height + 1, heightLimit, random));
    }

    /** Moves rows below the threshold to the front of the range; returns the first index at or above it. */
    private static int partition(double[][] rows, int[] order, int from, int to, int feature, double threshold) {
        int mid = from;
        for (int i = from; i < to; i++) {
            if (rows[order[i]][feature] < threshold) {
                int tmp = order[mid];
                order[mid] = order[i];
                order[i] = tmp;
                mid++;
            }
        }
        return mid;
    }

    /**
     * Edges from the root to the point's leaf, plus the expected remaining depth of the
     * leaf's unseparated samples.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int edges = 0;
        while (!node.isLeaf()) {
            node = node.next(point);
            edges++;
        }
        return edges + averagePathLength(node.getSize());
    }

    /**
     * Average path length of an unsuccessful binary search tree lookup over n samples:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    public IsolationNode getRoot() { return root; }
}
