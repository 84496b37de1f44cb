package com.herzen.curriculum.graph;

import com.herzen.curriculum.graph.GraphModels.DependencyEdge;
import com.herzen.curriculum.graph.GraphModels.DependencyGraph;

import java.util.*;

/** Cycle detection and bounded enumeration of elementary cycles. */
public final class GraphCycles {
    private GraphCycles() {}

    public static boolean isAcyclic(DependencyGraph graph) {
        return findCycle(graph).isEmpty();
    }

    /** One cycle found by a depth-first back-edge search, as its edges in path order. */
    public static Optional<List<DependencyEdge>> findCycle(DependencyGraph graph) {
        Map<String, List<DependencyEdge>> adj = graph.outgoing();
        Set<String> visited = new HashSet<>();
        Deque<DependencyEdge> path = new ArrayDeque<>();
        Map<String, Integer> onPath = new HashMap<>();
        for (String node : graph.nodes()) {
            List<DependencyEdge> cycle = visit(node, adj, visited, onPath, path);
            if (cycle != null) return Optional.of(cycle);
        }
        return Optional.empty();
    }

    private static List<DependencyEdge> visit(String node, Map<String, List<DependencyEdge>> adj, Set<String> visited,
                                              Map<String, Integer> onPath, Deque<DependencyEdge> path) {
        if (visited.contains(node)) return null;
        onPath.put(node, path.size());
        for (DependencyEdge edge : adj.getOrDefault(node, List.of())) {
            Integer depth = onPath.get(edge.dependent());
            if (depth != null) {
                List<DependencyEdge> cycle = new ArrayList<>(path).subList(depth, path.size());
                List<DependencyEdge> closed = new ArrayList<>(cycle);
                closed.add(edge);
                return closed;
            }
            path.addLast(edge);
            List<DependencyEdge> found = visit(edge.dependent(), adj, visited, onPath, path);
            if (found != null) return found;
            path.removeLast();
        }
        onPath.remove(node);
        visited.add(node);
        return null;
    }

    /**
     * Elementary cycles, each reported once starting from its earliest node in node order.
     * The search stays inside strongly connected components and stops after {@code limit}
     * cycles or {@code SEARCH_BUDGET} edge visits, whichever comes first.
     */
    public static List<List<DependencyEdge>> simpleCycles(DependencyGraph graph, int limit) {
        Map<String, List<DependencyEdge>> adj = graph.outgoing();
        Map<String, Integer> component = stronglyConnectedComponents(graph, adj);
        Map<String, Integer> position = new HashMap<>();
        int i = 0;
        for (String node : graph.nodes()) position.put(node, i++);

        Search search = new Search(adj, component, position, limit);
        for (String start : graph.nodes()) {
            if (search.exhausted()) break;
            search.from(start);
        }
        return search.cycles;
    }

    /** Component index per node (Tarjan). */
    public static Map<String, Integer> stronglyConnectedComponents(DependencyGraph graph,
                                                                   Map<String, List<DependencyEdge>> adj) {
        Tarjan tarjan = new Tarjan(adj);
        for (String node : graph.nodes()) {
            if (!tarjan.index.containsKey(node)) tarjan.connect(node);
        }
        return tarjan.component;
    }

    private static final int SEARCH_BUDGET = 200_000;

    private static final class Search {
        private final Map<String, List<DependencyEdge>> adj;
        private final Map<String, Integer> component;
        private final Map<String, Integer> position;
        private final int limit;
        private final List<List<DependencyEdge>> cycles = new ArrayList<>();
        private int visits;

        private Search(Map<String, List<DependencyEdge>> adj, Map<String, Integer> component,
                       Map<String, Integer> position, int limit) {
            this.adj = adj;
            this.component = component;
            this.position = position;
            this.limit = limit;
        }

        private boolean exhausted() {
            return cycles.size() >= limit || visits >= SEARCH_BUDGET;
        }

        private void from(String start) {
            Set<String> onPath = new HashSet<>();
            onPath.add(start);
            walk(start, start, onPath, new ArrayList<>());
        }

        private void walk(String start, String node, Set<String> onPath, List<DependencyEdge> path) {
            for (DependencyEdge edge : adj.getOrDefault(node, List.of())) {
                if (exhausted()) return;
                visits++;
                String next = edge.dependent();
                if (!component.get(next).equals(component.get(start))) continue;
                if (next.equals(start)) {
                    List<DependencyEdge> cycle = new ArrayList<>(path);
                    cycle.add(edge);
                    cycles.add(List.copyOf(cycle));
                } else if (position.get(next) > position.get(start) && onPath.add(next)) {
                    path.add(edge);
                    walk(start, next, onPath, path);
                    path.remove(path.size() - 1);
                    onPath.remove(next);
                }
            }
        }
    }

    private static final class Tarjan {
        private final Map<String, List<DependencyEdge>> adj;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final Map<String, Integer> component = new HashMap<>();
        private int counter;
        private int components;

        private Tarjan(Map<String, List<DependencyEdge>> adj) {
            this.adj = adj;
        }

        private void connect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (DependencyEdge edge : adj.getOrDefault(node, List.of())) {
                String next = edge.dependent();
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.put(member, components);
                } while (!member.equals(node));
                components++;
            }
        }
    }
}
