package com.ensemble.anomaly.detector;

import com.ensemble.anomaly.config.DetectionProperties;
import com.ensemble.anomaly.detector.graph.ActorNode;
import com.ensemble.anomaly.detector.graph.ActorType;
import com.ensemble.anomaly.detector.graph.FraudCluster;
import com.ensemble.anomaly.detector.graph.TransactionEdge;
import com.ensemble.anomaly.detector.graph.TransactionGraph;
import com.ensemble.anomaly.domain.AnomalyFinding;
import com.ensemble.anomaly.domain.DataRecord;
import com.ensemble.anomaly.domain.DetectionMethod;
import com.ensemble.anomaly.engine.SeverityClassifier;
import com.ensemble.anomaly.stats.NumericUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Relationship analysis over the customer/merchant transaction graph: clusters of actors linked
 * by fraud, merchants with outlying fraud rates, and customers with high fraud rates or
 * concentrated merchant usage.
 */
@Slf4j
@Component
@Order(6)
@RequiredArgsConstructor
public class GraphBasedDetector implements AnomalyDetector {

    private final DetectionProperties properties;

    @Override
    public List<AnomalyFinding> detect(List<DataRecord> records) {
        TransactionGraph graph = TransactionGraph.build(records);
        List<AnomalyFinding> findings = new ArrayList<>();
        findings.addAll(detectFraudClusters(graph, records));
        findings.addAll(detectMerchantAnomalies(graph, records));
        findings.addAll(detectCustomerAnomalies(graph, records));
        log.debug("Graph: nodes={}, edges={}, flagged={}",
                graph.getNodes().size(), graph.getEdges().size(), findings.size());
        return findings;
    }

    /**
     * Components of the actors touching a fraud-flagged edge, keeping only those larger than
     * {@code anomaly.detection.graph.min-cluster-size}.
     */
    public List<FraudCluster> findFraudClusters(TransactionGraph graph) {
        Set<String> fraudNodes = new LinkedHashSet<>();
        for (TransactionEdge edge : graph.getEdges()) {
            if (edge.isFraud()) {
                fraudNodes.add(edge.getFrom());
                fraudNodes.add(edge.getTo());
            }
        }
        List<List<String>> qualifying = new ArrayList<>();
        Map<String, Integer> clusterOf = new HashMap<>();
        for (List<String> component : graph.connectedComponents(fraudNodes)) {
            if (component.size() <= properties.getGraph().getMinClusterSize()) {
                continue;
            }
            for (String nodeKey : component) {
                clusterOf.put(nodeKey, qualifying.size());
            }
            qualifying.add(component);
        }
        int[] fraudEdgesInside = new int[qualifying.size()];
        for (TransactionEdge edge : graph.getEdges()) {
            Integer cluster = clusterOf.get(edge.getFrom());
            if (edge.isFraud() && cluster != null && cluster.equals(clusterOf.get(edge.getTo()))) {
                fraudEdgesInside[cluster]++;
            }
        }
        List<FraudCluster> clusters = new ArrayList<>(qualifying.size());
        for (int c = 0; c < qualifying.size(); c++) {
            clusters.add(new FraudCluster(c, List.copyOf(qualifying.get(c)), fraudEdgesInside[c]));
        }
        return clusters;
    }

    /**
     * One finding per cluster node, attached to one of its fraud transactions. A transaction not yet
     * used by another node of the same cluster is preferred so nodes do not collapse on deduplication.
     */
    private List<AnomalyFinding> detectFraudClusters(TransactionGraph graph, List<DataRecord> records) {
        List<AnomalyFinding> findings = new ArrayList<>();
        for (FraudCluster cluster : findFraudClusters(graph)) {
            double risk = cluster.getRisk();
            Set<Integer> claimed = new HashSet<>();
            for (String nodeKey : cluster.getNodeKeys()) {
                TransactionEdge anchor = null;
                for (TransactionEdge edge : graph.incidentEdges(nodeKey)) {
                    if (!edge.isFraud()) continue;
                    if (anchor == null) anchor = edge;
                    if (!claimed.contains(edge.getRecordIndex())) {
                        anchor = edge;
                        break;
                    }
                }
                if (anchor == null) continue;
                claimed.add(anchor.getRecordIndex());

                ActorNode node = graph.node(nodeKey);
                Map<String, Object> context = FindingContexts.forRecord(records.get(anchor.getRecordIndex()));
                context.put("clusterId", cluster.getClusterId());
                context.put("clusterSize", cluster.size());
                context.put("clusterRisk", risk);
                context.put("nodeType", node.getType().name().toLowerCase());
                context.put("actorId", node.getActorId());
                findings.add(finding(anchor.getRecordIndex(), risk, DetectionMethod.FRAUD_CLUSTER, context));
            }
        }
        return findings;
    }

    private List<AnomalyFinding> detectMerchantAnomalies(TransactionGraph graph, List<DataRecord> records) {
        DetectionProperties.Graph config = properties.getGraph();
        Map<String, ActorStats> merchantStats = new LinkedHashMap<>();
        for (TransactionEdge edge : graph.getEdges()) {
            merchantStats.computeIfAbsent(edge.getTo(), k -> new ActorStats()).add(edge);
        }
        List<AnomalyFinding> findings = new ArrayList<>();
        if (merchantStats.isEmpty()) {
            return findings;
        }
        double[] rates = merchantStats.values().stream().mapToDouble(ActorStats::fraudRate).toArray();
        double meanRate = NumericUtils.mean(rates);
        double stdRate = NumericUtils.populationStd(rates);

        for (Map.Entry<String, ActorStats> entry : merchantStats.entrySet()) {
            ActorStats stats = entry.getValue();
            OptionalDouble z = NumericUtils.absZScore(stats.fraudRate(), meanRate, stdRate);
            if (z.isEmpty() || z.getAsDouble() <= config.getMerchantZScoreThreshold()) {
                continue;
            }
            double score = z.getAsDouble() / config.getScoreDivisor();
            String merchantId = graph.node(entry.getKey()).getActorId();
            for (TransactionEdge edge : graph.incidentEdges(entry.getKey())) {
                Map<String, Object> context = FindingContexts.forRecord(records.get(edge.getRecordIndex()));
                context.put("merchantId", merchantId);
                context.put("fraudRate", stats.fraudRate());
                context.put("expectedFraudRate", meanRate);
                context.put("zScore", z.getAsDouble());
                stats.avgAmount().ifPresent(avg -> context.put("avgAmount", avg));
                stats.avgFraudScore().ifPresent(avg -> context.put("avgFraudScore", avg));
                findings.add(finding(edge.getRecordIndex(), score, DetectionMethod.MERCHANT_ANOMALY, context));
            }
        }
        return findings;
    }

    private List<AnomalyFinding> detectCustomerAnomalies(TransactionGraph graph, List<DataRecord> records) {
        DetectionProperties.Graph config = properties.getGraph();
        List<AnomalyFinding> findings = new ArrayList<>();
        for (ActorNode node : graph.getNodes().values()) {
            if (node.getType() != ActorType.CUSTOMER) continue;
            List<TransactionEdge> edges = graph.incidentEdges(node.getKey());
            if (edges.isEmpty()) continue;

            ActorStats stats = new ActorStats();
            Set<String> merchants = new HashSet<>();
            for (TransactionEdge edge : edges) {
                stats.add(edge);
                merchants.add(edge.getTo());
            }
            double fraudRate = stats.fraudRate();
            double diversity = (double) merchants.size() / stats.count;
            if (fraudRate <= config.getCustomerFraudRateThreshold() && diversity >= config.getCustomerDiversityThreshold()) {
                continue;
            }
            double score = Math.max(fraudRate, 1.0 - diversity);
            for (TransactionEdge edge : edges) {
                Map<String, Object> context = FindingContexts.forRecord(records.get(edge.getRecordIndex()));
                context.put("customerId", node.getActorId());
                context.put("fraudRate", fraudRate);
                context.put("merchantDiversity", diversity);
                context.put("transactionCount", stats.count);
                findings.add(finding(edge.getRecordIndex(), score, DetectionMethod.CUSTOMER_ANOMALY, context));
            }
        }
        return findings;
    }

    private static AnomalyFinding finding(int recordIndex, double score, DetectionMethod method,
                                          Map<String, Object> context) {
        return AnomalyFinding.builder()
                .recordIndex(recordIndex)
                .score(score)
                .method(method)
                .severity(SeverityClassifier.classify(score))
                .context(FindingContexts.freeze(context))
                .build();
    }

    @Override
    public String getDetectorName() {
        return "GraphBased";
    }

    private static final class ActorStats {
        int count;
        int fraudCount;
        double amountSum;
        int amountCount;
        double fraudScoreSum;
        int fraudScoreCount;

        void add(TransactionEdge edge) {
            count++;
            if (edge.isFraud()) fraudCount++;
            if (!Double.isNaN(edge.getAmount())) {
                amountSum += edge.getAmount();
                amountCount++;
            }
            if (!Double.isNaN(edge.getFraudScore())) {
                fraudScoreSum += edge.getFraudScore();
                fraudScoreCount++;
            }
        }

        double fraudRate() {
            return count == 0 ? 0.0 : (double) fraudCount / count;
        }

        OptionalDouble avgAmount() {
            return amountCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(amountSum / amountCount);
        }

        OptionalDouble avgFraudScore() {
            return fraudScoreCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(fraudScoreSum / fraudScoreCount);
        }
    }
}
