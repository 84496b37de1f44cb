package com.herzen.curriculum.sequence;

import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.EducationalTier;
import com.herzen.curriculum.graph.GraphModels.ClusterGraph;
import com.herzen.curriculum.graph.GraphModels.DependencyEdge;
import com.herzen.curriculum.graph.GraphModels.DependencyGraph;
import com.herzen.curriculum.sequence.SequenceModels.ClusterSequence;
import com.herzen.curriculum.sequence.SequenceModels.SequenceNode;
import com.herzen.curriculum.sequence.SequenceModels.SequencingIssue;
import com.herzen.curriculum.sequence.SequenceModels.SequencingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Linearizes a graph tier by tier: all nodes of an earlier tier come first, and inside a tier
 * the nodes follow a topological order of the tier's induced subgraph. Among nodes that are
 * ready at the same time, input order decides.
 */
@Component
public class LevelAwareSequencer {
    private static final Logger log = LoggerFactory.getLogger(LevelAwareSequencer.class);

    public static final String TIER_CYCLE_FALLBACK = "TIER_CYCLE_FALLBACK";

    public SequencingResult sequence(DependencyGraph graph, List<SequenceNode> nodes) {
        Map<EducationalTier, List<SequenceNode>> buckets = new EnumMap<>(EducationalTier.class);
        for (SequenceNode node : nodes) {
            buckets.computeIfAbsent(node.tier(), k -> new ArrayList<>()).add(node);
        }

        List<String> order = new ArrayList<>(nodes.size());
        List<SequencingIssue> issues = new ArrayList<>();
        for (var bucket : buckets.entrySet()) {
            List<String> ids = bucket.getValue().stream().map(SequenceNode::id).toList();
            DependencyGraph induced = graph.induced(new HashSet<>(ids));
            List<String> sorted = topologicalOrder(induced, ids);
            if (sorted.size() == ids.size()) {
                order.addAll(sorted);
                continue;
            }

            List<String> byDifficulty = bucket.getValue().stream()
                    .sorted(Comparator.comparingInt(SequenceNode::difficulty))
                    .map(SequenceNode::id)
                    .toList();
            log.warn("Tier {} still has a prerequisite cycle, ordering its {} nodes by difficulty",
                    bucket.getKey().label(), ids.size());
            issues.add(new SequencingIssue(TIER_CYCLE_FALLBACK, bucket.getKey(), byDifficulty,
                    "Cycle inside tier " + bucket.getKey().label() + "; ordered by declared difficulty"));
            order.addAll(byDifficulty);
        }
        return new SequencingResult(order, issues);
    }

    /**
     * Orders clusters for expansion. Each cluster is first promoted to the latest tier among
     * its prerequisites, so that prerequisite order and tier order cannot disagree.
     */
    public ClusterSequence sequenceClusters(ClusterGraph clusterGraph) {
        List<Cluster> clusters = clusterGraph.clusters();
        Map<String, EducationalTier> own = new LinkedHashMap<>();
        clusters.forEach(c -> own.put(c.id(), c.tier()));
        Map<String, EducationalTier> effective = effectiveTiers(clusterGraph.graph(), own);

        Map<String, Cluster> byId = new HashMap<>();
        List<SequenceNode> nodes = new ArrayList<>();
        for (Cluster cluster : clusters) {
            EducationalTier tier = effective.get(cluster.id());
            if (tier != cluster.tier()) {
                log.debug("Cluster {} promoted from {} to {}", cluster.id(), cluster.tier().label(), tier.label());
            }
            byId.put(cluster.id(), cluster.withTier(tier));
            nodes.add(new SequenceNode(cluster.id(), tier, cluster.difficulty()));
        }

        SequencingResult result = sequence(clusterGraph.graph(), nodes);
        List<Cluster> ordered = result.order().stream().map(byId::get).toList();
        log.info("Sequenced {} clusters across {} tiers", ordered.size(),
                ordered.stream().map(Cluster::tier).distinct().count());
        return new ClusterSequence(ordered, result.issues());
    }

    /** Each node's tier raised to the latest tier found among its transitive prerequisites. */
    public Map<String, EducationalTier> effectiveTiers(DependencyGraph graph, Map<String, EducationalTier> tiers) {
        Map<String, EducationalTier> effective = new LinkedHashMap<>(tiers);
        boolean changed = true;
        int rounds = 0;
        while (changed && rounds++ <= graph.nodes().size()) {
            changed = false;
            for (DependencyEdge edge : graph.edges()) {
                EducationalTier before = effective.get(edge.prerequisite());
                EducationalTier after = effective.get(edge.dependent());
                if (before == null || after == null) continue;
                if (before.compareTo(after) > 0) {
                    effective.put(edge.dependent(), before);
                    changed = true;
                }
            }
        }
        return effective;
    }

    private List<String> topologicalOrder(DependencyGraph graph, List<String> inputOrder) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < inputOrder.size(); i++) position.put(inputOrder.get(i), i);

        Map<String, Integer> indegree = new HashMap<>();
        inputOrder.forEach(id -> indegree.put(id, 0));
        for (DependencyEdge e : graph.edges()) indegree.merge(e.dependent(), 1, Integer::sum);

        Map<String, List<DependencyEdge>> adj = graph.outgoing();
        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(position::get));
        for (String id : inputOrder) if (indegree.get(id) == 0) ready.add(id);

        List<String> sorted = new ArrayList<>(inputOrder.size());
        while (!ready.isEmpty()) {
            String next = ready.poll();
            sorted.add(next);
            for (DependencyEdge e : adj.getOrDefault(next, List.of())) {
                if (indegree.merge(e.dependent(), -1, Integer::sum) == 0) ready.add(e.dependent());
            }
        }
        return sorted;
    }
}
