package com.ensemble.anomaly.detector.graph;

import lombok.Value;

import java.util.List;

/**
 * Connected component of actors linked by fraud-flagged transactions.
 */
@Value
public class FraudCluster {

    int clusterId;
    /** Node keys in discovery order. */
    List<String> nodeKeys;
    /** Fraud-flagged edges with both ends in the cluster. */
    int fraudEdgeCount;

    public int size() {
        return nodeKeys.size();
    }

    /** Fraud edges inside the cluster per node. */
    public double getRisk() {
        return nodeKeys.isEmpty() ? 0.0 : (double) fraudEdgeCount / nodeKeys.size();
    }
}
