package com.herzen.curriculum.graph;

import com.herzen.curriculum.config.CurriculumProperties;
import com.herzen.curriculum.graph.GraphModels.CycleResolution;
import com.herzen.curriculum.graph.GraphModels.DependencyEdge;
import com.herzen.curriculum.graph.GraphModels.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Breaks prerequisite cycles by dropping the weakest edge of each cycle. Once the iteration
 * cap is reached, whatever still loops is cut by forced removal of the newest edge on each
 * remaining cycle.
 */
@Component
public class CycleResolver {
    private static final Logger log = LoggerFactory.getLogger(CycleResolver.class);

    private static final int CYCLES_PER_ITERATION = 1_000;

    private static final Comparator<DependencyEdge> WEAKEST_FIRST = Comparator
            .comparingDouble(DependencyEdge::strength)
            .thenComparing(Comparator.comparingInt(DependencyEdge::order).reversed());

    private final CurriculumProperties properties;

    public CycleResolver(CurriculumProperties properties) {
        this.properties = properties;
    }

    public CycleResolution resolveCycles(DependencyGraph graph) {
        return resolveCycles(graph, graph.nodes().size());
    }

    /** @param clusterCount basis of the iteration cap, multiplied by the configured factor */
    public CycleResolution resolveCycles(DependencyGraph graph, int clusterCount) {
        if (GraphCycles.isAcyclic(graph)) {
            return new CycleResolution(graph, List.of(), List.of(), 0);
        }

        int cap = Math.max(0, clusterCount * properties.getCycleIterationFactor());
        DependencyGraph current = graph;
        List<DependencyEdge> removed = new ArrayList<>();
        int iterations = 0;

        while (iterations < cap) {
            List<List<DependencyEdge>> cycles = GraphCycles.simpleCycles(current, CYCLES_PER_ITERATION);
            if (cycles.isEmpty()) break;
            iterations++;

            Set<String> cut = new HashSet<>();
            List<DependencyEdge> round = new ArrayList<>();
            for (List<DependencyEdge> cycle : cycles) {
                if (cycle.stream().anyMatch(e -> cut.contains(e.key()))) continue;
                DependencyEdge weakest = cycle.stream().min(WEAKEST_FIRST).orElseThrow();
                cut.add(weakest.key());
                round.add(weakest);
                log.debug("Removing {} (strength {}, {}) from a cycle of {} edges",
                        weakest.key(), weakest.strength(), weakest.provenance(), cycle.size());
            }
            current = current.without(round);
            removed.addAll(round);
        }

        List<DependencyEdge> forced = new ArrayList<>();
        Optional<List<DependencyEdge>> remaining = GraphCycles.findCycle(current);
        while (remaining.isPresent()) {
            DependencyEdge newest = remaining.get().stream()
                    .max(Comparator.comparingInt(DependencyEdge::order))
                    .orElseThrow();
            log.warn("Cycle still present after {} iterations, forcing removal of {}", iterations, newest.key());
            forced.add(newest);
            current = current.without(List.of(newest));
            remaining = GraphCycles.findCycle(current);
        }

        log.info("Resolved cycles in {} iterations: {} edges removed, {} forced", iterations, removed.size(), forced.size());
        return new CycleResolution(current, removed, forced, iterations);
    }
}
