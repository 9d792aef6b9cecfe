package com.ensemble.anomaly.detector.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Customer or merchant in the transaction graph, with the ids of its incident transactions.
 */
public final class ActorNode {

    private final String key;
    private final String actorId;
    private final ActorType type;
    private final List<String> transactionIds = new ArrayList<>();

    ActorNode(String key, String actorId, ActorType type) {
        this.key = key;
        this.actorId = actorId;
        this.type = type;
    }

    void addTransaction(String transactionId) {
        transactionIds.add(transactionId);
    }

    /** Graph-unique key; customer and merchant ids may overlap, keys never do. */
    public String getKey() {
        return key;
    }

    public String getActorId() {
        return actorId;
    }

    public ActorType getType() {
        return type;
    }

    public List<String> getTransactionIds() {
        return Collections.unmodifiableList(transactionIds);
    }
}
