package com.ensemble.anomaly.detector.iforest;

/**
 * Node of an isolation tree: either a {@link LeafNode} or an {@link InternalNode}.
 * Nodes are immutable and owned by the tree that built them.
 */
public interface IsolationTreeNode {

    boolean isLeaf();
}
