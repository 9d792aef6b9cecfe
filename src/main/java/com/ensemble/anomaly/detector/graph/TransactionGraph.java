package com.ensemble.anomaly.detector.graph;

import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.features.RecordFeatures;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Bipartite customer/merchant graph with one edge per transaction. Built once per run and
 * read-only afterwards. Records missing either actor id are not part of the graph.
 */
public final class TransactionGraph {

    private final Map<String, ActorNode> nodes;
    private final List<TransactionEdge> edges;
    private final Map<String, List<TransactionEdge>> incident;

    private TransactionGraph(Map<String, ActorNode> nodes, List<TransactionEdge> edges,
                             Map<String, List<TransactionEdge>> incident) {
        this.nodes = nodes;
        this.edges = edges;
        this.incident = incident;
    }

    public static TransactionGraph build(List<DataRecord> records) {
        Map<String, ActorNode> nodes = new LinkedHashMap<>();
        List<TransactionEdge> edges = new ArrayList<>();
        Map<String, List<TransactionEdge>> incident = new LinkedHashMap<>();

        for (int i = 0; i < records.size(); i++) {
            DataRecord record = records.get(i);
            Optional<String> customerId = RecordFeatures.text(record, RecordFeatures.CUSTOMER_ID);
            Optional<String> merchantId = RecordFeatures.text(record, RecordFeatures.MERCHANT_ID);
            if (customerId.isEmpty() || merchantId.isEmpty()) {
                continue;
            }
            String transactionId = RecordFeatures.text(record, RecordFeatures.TRANSACTION_ID).orElse("row-" + i);
            ActorNode customer = nodes.computeIfAbsent(customerKey(customerId.get()),
                    k -> new ActorNode(k, customerId.get(), ActorType.CUSTOMER));
            ActorNode merchant = nodes.computeIfAbsent(merchantKey(merchantId.get()),
                    k -> new ActorNode(k, merchantId.get(), ActorType.MERCHANT));
            customer.addTransaction(transactionId);
            merchant.addTransaction(transactionId);

            OptionalDouble amount = RecordFeatures.amount(record);
            OptionalDouble fraudScore = RecordFeatures.fraudScore(record);
            TransactionEdge edge = new TransactionEdge(transactionId, i, customer.getKey(), merchant.getKey(),
                    amount.isPresent() ? amount.getAsDouble() : Double.NaN,
                    RecordFeatures.isFraud(record),
                    fraudScore.isPresent() ? fraudScore.getAsDouble() : Double.NaN);
            edges.add(edge);
            incident.computeIfAbsent(customer.getKey(), k -> new ArrayList<>()).add(edge);
            incident.computeIfAbsent(merchant.getKey(), k -> new ArrayList<>()).add(edge);
        }
        return new TransactionGraph(nodes, edges, incident);
    }

    public static String customerKey(String customerId) {
        return "customer:" + customerId;
    }

    public static String merchantKey(String merchantId) {
        return "merchant:" + merchantId;
    }

    public Map<String, ActorNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public ActorNode node(String key) {
        return nodes.get(key);
    }

    public List<TransactionEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<TransactionEdge> incidentEdges(String nodeKey) {
        return incident.getOrDefault(nodeKey, List.of());
    }

    /**
     * Connected components of the subgraph induced by {@code subset}, discovered with an explicit
     * stack so component size is not limited by call-stack depth. Components come out in the
     * iteration order of {@code subset}.
     */
    public List<List<String>> connectedComponents(Collection<String> subset) {
        Set<String> allowed = new HashSet<>(subset);
        Set<String> visited = new HashSet<>();
        List<List<String>> components = new ArrayList<>();
        for (String start : subset) {
            if (!visited.add(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String current = stack.pop();
                component.add(current);
                for (TransactionEdge edge : incidentEdges(current)) {
                    String neighbor = edge.otherEnd(current);
                    if (allowed.contains(neighbor) && visited.add(neighbor)) {
                        stack.push(neighbor);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }
}
