package com.ensemble.anomaly.detector.graph;

import lombok.Value;

/**
 * One transaction: customer node to merchant node.
 */
@Value
public class TransactionEdge {

    String transactionId;
    /** Index of the source record in the original input. */
    int recordIndex;
    String from;
    String to;
    /** NaN when the record has no parseable amount. */
    double amount;
    boolean fraud;
    /** NaN when the record has no parseable fraud score. */
    double fraudScore;

    public String otherEnd(String nodeKey) {
        return from.equals(nodeKey) ? to : from;
    }
}
