package com.ensemble.anomaly.detector.iforest;

import lombok.Value;

/**
 * Split on one feature: values below {@code splitValue} go left, everything else
 * (including records missing the feature) goes right.
 */
@Value
public class InternalNode implements IsolationTreeNode {

    int feature;
    double splitValue;
    IsolationTreeNode left;
    IsolationTreeNode right;

    @Override
    public boolean isLeaf() {
        return false;
    }

    IsolationTreeNode route(double value) {
        return !Double.isNaN(value) && value < splitValue ? left : right;
    }
}
