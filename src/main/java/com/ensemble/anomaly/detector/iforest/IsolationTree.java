package com.ensemble.anomaly.detector.iforest;

import com.ensemble.anomaly.features.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * One randomized partition tree. Built from a sample; answers path-length queries for any point.
 */
public final class IsolationTree {

    /** Euler–Mascheroni constant. */
    public static final double EULER_GAMMA = 0.5772156649;

    private final IsolationTreeNode root;

    public IsolationTree(IsolationTreeNode root) {
        this.root = root;
    }

    /**
     * Grows a tree over {@code sample}. Recursion stops at {@code maxDepth} or when a partition holds
     * at most one record. Depth is bounded by ceil(log2(sample size)), so recursion stays shallow.
     */
    public static IsolationTree build(List<FeatureVector> sample, int maxDepth, Random random) {
        return new IsolationTree(grow(sample, 0, maxDepth, random));
    }

    private static IsolationTreeNode grow(List<FeatureVector> data, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || data.size() <= 1) {
            return new LeafNode(data.size());
        }
        List<Integer> present = presentFeatures(data);
        if (present.isEmpty()) {
            return new LeafNode(data.size());
        }
        int feature = present.get(random.nextInt(present.size()));
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (FeatureVector v : data) {
            if (v.isPresent(feature)) {
                min = Math.min(min, v.get(feature));
                max = Math.max(max, v.get(feature));
            }
        }
        double splitValue = min + random.nextDouble() * (max - min);

        if (min == max) {
            // degenerate split: both children see the whole partition until the depth limit
            return new InternalNode(feature, splitValue,
                    grow(data, depth + 1, maxDepth, random),
                    grow(data, depth + 1, maxDepth, random));
        }
        List<FeatureVector> left = new ArrayList<>();
        List<FeatureVector> right = new ArrayList<>();
        for (FeatureVector v : data) {
            if (v.isPresent(feature) && v.get(feature) < splitValue) {
                left.add(v);
            } else {
                right.add(v);
            }
        }
        return new InternalNode(feature, splitValue,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }

    private static List<Integer> presentFeatures(List<FeatureVector> data) {
        List<Integer> present = new ArrayList<>();
        int dims = data.get(0).dimension();
        for (int f = 0; f < dims; f++) {
            for (FeatureVector v : data) {
                if (v.isPresent(f)) {
                    present.add(f);
                    break;
                }
            }
        }
        return present;
    }

    /**
     * Number of splits to reach a leaf, plus c(leaf size) to account for the unbuilt subtree.
     */
    public double pathLength(FeatureVector point) {
        IsolationTreeNode node = root;
        double length = 0.0;
        while (!node.isLeaf()) {
            InternalNode internal = (InternalNode) node;
            node = internal.route(point.get(internal.getFeature()));
            length += 1.0;
        }
        return length + expectedPathLength(((LeafNode) node).getSize());
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2(ln(n-1) + γ) - 2(n-1)/n for n > 1, else 0.
     */
    public static double expectedPathLength(int n) {
        if (n <= 1) return 0.0;
        return 2.0 * (Math.log(n - 1) + EULER_GAMMA) - 2.0 * (n - 1) / (double) n;
    }

    public IsolationTreeNode getRoot() {
        return root;
    }
}
