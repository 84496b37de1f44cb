package com.herzen.curriculum.graph;

import com.herzen.curriculum.config.DisciplineProfile;
import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;
import com.herzen.curriculum.domain.DomainModels.VariantKind;
import com.herzen.curriculum.graph.GraphModels.ClusterGraph;
import com.herzen.curriculum.graph.GraphModels.DependencyEdge;
import com.herzen.curriculum.graph.GraphModels.DependencyGraph;
import com.herzen.curriculum.graph.GraphModels.EdgeProvenance;
import com.herzen.curriculum.graph.GraphModels.SubtopicGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Derives prerequisite edges between clusters, and later between generated items.
 * <p>
 * Explicit edges (declared cluster prerequisites and the profile's area prerequisites) win
 * over pattern-derived ones for the same pair. Hierarchy level on its own never produces an
 * edge; level order is left to the sequencer.
 * <p>
 * Pattern and ladder keywords are matched against a cluster's label as well as its member
 * concepts, so a cluster labelled "Waves" picks up the waves rule even when none of its
 * concepts mention waves.
 */
@Component
public class DependencyGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    static final double EXPLICIT_STRENGTH = 1.0;
    static final double PATTERN_STRENGTH = 0.8;

    public ClusterGraph buildGraph(List<Cluster> clusters, DisciplineProfile profile) {
        Map<String, Cluster> byId = new LinkedHashMap<>();
        clusters.forEach(c -> byId.put(c.id(), c));
        Map<String, String> text = new HashMap<>();
        clusters.forEach(c -> text.put(c.id(), searchText(c)));

        EdgeCollector edges = new EdgeCollector();

        for (Cluster dependent : clusters) {
            for (String required : dependent.prerequisiteClusterIds()) {
                if (byId.containsKey(required)) {
                    edges.add(required, dependent.id(), EXPLICIT_STRENGTH, EdgeProvenance.EXPLICIT);
                } else {
                    log.warn("Cluster {} declares unknown prerequisite {}", dependent.id(), required);
                }
            }
        }

        for (Cluster dependent : clusters) {
            List<String> requiredAreas = profile.explicitAreaPrerequisites().getOrDefault(dependent.label(), List.of());
            for (Cluster prerequisite : clusters) {
                if (requiredAreas.contains(prerequisite.label()) && notDeeper(prerequisite, dependent)) {
                    edges.add(prerequisite.id(), dependent.id(), EXPLICIT_STRENGTH, EdgeProvenance.EXPLICIT);
                }
            }
        }

        for (var pattern : profile.prerequisitePatterns().entrySet()) {
            for (Cluster dependent : clusters) {
                if (!text.get(dependent.id()).contains(pattern.getKey())) continue;
                for (Cluster prerequisite : clusters) {
                    if (!notDeeper(prerequisite, dependent)) continue;
                    String candidate = text.get(prerequisite.id());
                    if (pattern.getValue().stream().anyMatch(candidate::contains)) {
                        edges.add(prerequisite.id(), dependent.id(), PATTERN_STRENGTH, EdgeProvenance.PATTERN_DERIVED);
                    }
                }
            }
        }

        for (List<String> ladder : profile.progressionLadders()) {
            for (Cluster dependent : clusters) {
                int upper = highestRung(ladder, text.get(dependent.id()));
                if (upper <= 0) continue;
                for (Cluster prerequisite : clusters) {
                    int lower = highestRung(ladder, text.get(prerequisite.id()));
                    if (lower >= 0 && lower < upper && notDeeper(prerequisite, dependent)) {
                        edges.add(prerequisite.id(), dependent.id(), PATTERN_STRENGTH, EdgeProvenance.PATTERN_DERIVED);
                    }
                }
            }
        }

        DependencyGraph graph = new DependencyGraph(byId.keySet(), edges.edges());
        log.info("Dependency graph for {}: {} clusters, {} edges ({} explicit)", profile.name(),
                graph.nodes().size(), graph.edges().size(),
                graph.edges().stream().filter(e -> e.provenance() == EdgeProvenance.EXPLICIT).count());
        return new ClusterGraph(graph, withPrerequisitesFrom(graph, clusters));
    }

    /** Copies the graph's incoming edges into each cluster's prerequisite set. */
    public List<Cluster> withPrerequisitesFrom(DependencyGraph graph, List<Cluster> clusters) {
        return clusters.stream()
                .map(c -> c.withPrerequisites(graph.nodes().contains(c.id()) ? graph.prerequisitesOf(c.id()) : Set.of()))
                .toList();
    }

    /**
     * Item-level edges over an expanded sequence, using the cluster graph as skeleton. The
     * foundational item of every concept depends on the first item of each prerequisite
     * cluster; every other item of a concept depends on that concept's foundational item.
     * Items are returned with their prerequisite lists filled, positions untouched.
     */
    public SubtopicGraph linkSubtopics(List<SubtopicRecord> items, DependencyGraph clusterGraph) {
        Map<String, String> firstOfCluster = new HashMap<>();
        Map<String, String> foundationalOf = new HashMap<>();
        for (SubtopicRecord item : items) {
            firstOfCluster.putIfAbsent(item.clusterId(), item.id());
            if (item.variantKind() == VariantKind.FOUNDATIONAL) {
                foundationalOf.putIfAbsent(conceptKey(item), item.id());
            }
        }

        EdgeCollector edges = new EdgeCollector();
        List<SubtopicRecord> linked = new ArrayList<>(items.size());
        for (SubtopicRecord item : items) {
            List<String> prerequisites = new ArrayList<>();
            if (item.variantKind() == VariantKind.FOUNDATIONAL) {
                Set<String> requiredClusters = clusterGraph.nodes().contains(item.clusterId())
                        ? clusterGraph.prerequisitesOf(item.clusterId())
                        : Set.of();
                for (String required : requiredClusters) {
                    String first = firstOfCluster.get(required);
                    if (first != null && edges.add(first, item.id(), EXPLICIT_STRENGTH, EdgeProvenance.EXPLICIT)) {
                        prerequisites.add(first);
                    }
                }
            } else {
                String foundational = foundationalOf.get(conceptKey(item));
                if (foundational == null) foundational = firstOfCluster.get(item.clusterId());
                if (foundational != null && !foundational.equals(item.id())
                        && edges.add(foundational, item.id(), PATTERN_STRENGTH, EdgeProvenance.PATTERN_DERIVED)) {
                    prerequisites.add(foundational);
                }
            }
            linked.add(new SubtopicRecord(item.id(), item.clusterId(), item.title(), item.parentConcept(),
                    item.educationalTier(), item.cognitiveLevel(), item.variantKind(), prerequisites,
                    item.questionTypes(), item.learningObjectives(), item.sequenceIndex()));
        }

        List<String> ids = items.stream().map(SubtopicRecord::id).toList();
        DependencyGraph graph = new DependencyGraph(new LinkedHashSet<>(ids), edges.edges());
        log.debug("Linked {} items with {} prerequisite edges", items.size(), graph.edges().size());
        return new SubtopicGraph(graph, linked);
    }

    private static String conceptKey(SubtopicRecord item) {
        return item.clusterId() + "|" + item.parentConcept();
    }

    private static boolean notDeeper(Cluster prerequisite, Cluster dependent) {
        return prerequisite.hierarchyLevel() <= dependent.hierarchyLevel();
    }

    private static String searchText(Cluster cluster) {
        StringBuilder sb = new StringBuilder(cluster.label().toLowerCase(Locale.ROOT));
        for (String concept : cluster.memberConcepts()) {
            sb.append(" | ").append(concept.toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static int highestRung(List<String> ladder, String text) {
        for (int i = ladder.size() - 1; i >= 0; i--) {
            if (text.contains(ladder.get(i))) return i;
        }
        return -1;
    }

    /** First edge per ordered pair wins; self-loops are ignored. */
    private static final class EdgeCollector {
        private final Map<String, DependencyEdge> edges = new LinkedHashMap<>();

        boolean add(String prerequisite, String dependent, double strength, EdgeProvenance provenance) {
            if (prerequisite.equals(dependent)) return false;
            String key = prerequisite + "->" + dependent;
            if (edges.containsKey(key)) return false;
            edges.put(key, new DependencyEdge(prerequisite, dependent, strength, provenance, edges.size()));
            return true;
        }

        List<DependencyEdge> edges() {
            return new ArrayList<>(edges.values());
        }
    }
}
