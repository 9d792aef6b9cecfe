package com.ensemble.anomaly.detector.iforest;

import lombok.Value;

/**
 * Terminal partition; size is the number of sample records that reached it.
 */
@Value
public class LeafNode implements IsolationTreeNode {

    int size;

    @Override
    public boolean isLeaf() {
        return true;
    }
}
