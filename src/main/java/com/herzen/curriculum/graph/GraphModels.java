package com.herzen.curriculum.graph;

import com.herzen.curriculum.domain.DomainModels.Cluster;
import com.herzen.curriculum.domain.DomainModels.SubtopicRecord;

import java.util.*;
import java.util.stream.Collectors;

public class GraphModels {

    public enum EdgeProvenance { EXPLICIT, PATTERN_DERIVED, LEVEL_DERIVED }

    /**
     * Prerequisite edge. {@code order} is the insertion position within the graph's build and
     * decides which of two equally weak edges counts as the most recently added.
     */
    public record DependencyEdge(String prerequisite, String dependent, double strength,
                                 EdgeProvenance provenance, int order) {
        public DependencyEdge {
            if (prerequisite.equals(dependent)) {
                throw new IllegalArgumentException("Self-loop on " + prerequisite);
            }
            if (strength <= 0.0 || strength > 1.0) {
                throw new IllegalArgumentException("Edge strength must be in (0,1]: " + strength);
            }
        }

        public String key() {
            return prerequisite + "->" + dependent;
        }
    }

    /** Immutable node set plus at most one edge per ordered node pair. */
    public record DependencyGraph(Set<String> nodes, List<DependencyEdge> edges) {
        public DependencyGraph {
            nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
            Map<String, DependencyEdge> unique = new LinkedHashMap<>();
            for (DependencyEdge e : edges) {
                if (!nodes.contains(e.prerequisite()) || !nodes.contains(e.dependent())) {
                    throw new IllegalArgumentException("Edge references unknown node: " + e.key());
                }
                unique.putIfAbsent(e.key(), e);
            }
            edges = List.copyOf(unique.values());
        }

        public boolean hasEdge(String prerequisite, String dependent) {
            return edges.stream().anyMatch(e -> e.prerequisite().equals(prerequisite) && e.dependent().equals(dependent));
        }

        public Set<String> prerequisitesOf(String node) {
            return edges.stream()
                    .filter(e -> e.dependent().equals(node))
                    .map(DependencyEdge::prerequisite)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        public Map<String, List<DependencyEdge>> outgoing() {
            Map<String, List<DependencyEdge>> adj = new LinkedHashMap<>();
            nodes.forEach(n -> adj.put(n, new ArrayList<>()));
            edges.forEach(e -> adj.get(e.prerequisite()).add(e));
            return adj;
        }

        public DependencyGraph induced(Set<String> subset) {
            Set<String> kept = new LinkedHashSet<>();
            nodes.stream().filter(subset::contains).forEach(kept::add);
            List<DependencyEdge> inner = edges.stream()
                    .filter(e -> kept.contains(e.prerequisite()) && kept.contains(e.dependent()))
                    .toList();
            return new DependencyGraph(kept, inner);
        }

        public DependencyGraph without(Collection<DependencyEdge> removed) {
            Set<String> removedKeys = new HashSet<>();
            removed.forEach(e -> removedKeys.add(e.key()));
            return new DependencyGraph(nodes, edges.stream().filter(e -> !removedKeys.contains(e.key())).toList());
        }
    }

    public record ClusterGraph(DependencyGraph graph, List<Cluster> clusters) {}

    public record SubtopicGraph(DependencyGraph graph, List<SubtopicRecord> subtopics) {}

    public record CycleResolution(DependencyGraph graph, List<DependencyEdge> removedEdges,
                                  List<DependencyEdge> forcedRemovals, int iterations) {
        public boolean changed() {
            return !removedEdges.isEmpty() || !forcedRemovals.isEmpty();
        }
    }
}
