package com.phillippitts.servicegraph.service.graph;

import com.phillippitts.servicegraph.domain.DependencyEdge;
import com.phillippitts.servicegraph.domain.ResolvedDependency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph over enabled services. Edges point from the service that must start first to
 * the service that depends on it.
 *
 * <p>Hard edges (capability requirements) decide ordering feasibility. Soft edges (declared
 * {@code after} preferences) are kept apart and only break ties between services that are
 * otherwise free to start. Node order is the catalog registration order and drives every
 * traversal, which keeps results reproducible.
 *
 * <p>Immutable and thread-safe.
 */
public final class DependencyGraph {

    private final List<String> nodes;
    private final List<DependencyEdge> edges;
    private final Map<String, List<String>> hardSuccessors;
    private final Map<String, Set<String>> hardPredecessors;
    private final Map<String, Set<String>> softPredecessors;
    private final Map<String, ResolvedDependency> resolved;

    private DependencyGraph(List<String> nodes,
                            List<DependencyEdge> edges,
                            Map<String, ResolvedDependency> resolved) {
        this.nodes = List.copyOf(new LinkedHashSet<>(nodes));
        Map<String, Integer> position = new LinkedHashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            position.put(this.nodes.get(i), i);
        }

        Map<String, List<String>> successors = new LinkedHashMap<>();
        Map<String, Set<String>> predecessors = new LinkedHashMap<>();
        Map<String, Set<String>> soft = new LinkedHashMap<>();
        for (String node : this.nodes) {
            successors.put(node, new ArrayList<>());
            predecessors.put(node, new LinkedHashSet<>());
            soft.put(node, new LinkedHashSet<>());
        }

        List<DependencyEdge> accepted = new ArrayList<>();
        for (DependencyEdge edge : edges) {
            if (!position.containsKey(edge.from()) || !position.containsKey(edge.to())) {
                throw new IllegalArgumentException("Edge " + edge.from() + " -> " + edge.to()
                        + " references a service that is not a graph node");
            }
            if (edge.kind() == DependencyEdge.Kind.HARD) {
                if (predecessors.get(edge.to()).add(edge.from())) {
                    successors.get(edge.from()).add(edge.to());
                    accepted.add(edge);
                }
            } else if (soft.get(edge.to()).add(edge.from())) {
                accepted.add(edge);
            }
        }
        successors.values().forEach(list -> list.sort((a, b) -> position.get(a) - position.get(b)));

        this.edges = List.copyOf(accepted);
        this.hardSuccessors = freezeLists(successors);
        this.hardPredecessors = freezeSets(predecessors);
        this.softPredecessors = freezeSets(soft);
        this.resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    /**
     * Creates a graph from explicit nodes and edges.
     *
     * @param nodes services in tie-break order
     * @param edges hard and soft edges between those services; duplicates are ignored
     * @return new graph
     * @throws IllegalArgumentException if an edge references an unknown node
     */
    public static DependencyGraph of(List<String> nodes, Collection<DependencyEdge> edges) {
        return new DependencyGraph(nodes, List.copyOf(edges), Map.of());
    }

    static DependencyGraph of(List<String> nodes,
                              Collection<DependencyEdge> edges,
                              Map<String, ResolvedDependency> resolved) {
        return new DependencyGraph(nodes, List.copyOf(edges), resolved);
    }

    public List<String> nodes() {
        return nodes;
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public List<DependencyEdge> hardEdges() {
        return edges.stream().filter(e -> e.kind() == DependencyEdge.Kind.HARD).toList();
    }

    public List<String> hardSuccessors(String node) {
        return hardSuccessors.getOrDefault(node, List.of());
    }

    public Set<String> hardPredecessors(String node) {
        return hardPredecessors.getOrDefault(node, Set.of());
    }

    public Set<String> softPredecessors(String node) {
        return softPredecessors.getOrDefault(node, Set.of());
    }

    public Optional<ResolvedDependency> resolved(String node) {
        return Optional.ofNullable(resolved.get(node));
    }

    /** Resolved dependencies in node order; empty for graphs built from raw edges. */
    public List<ResolvedDependency> resolvedDependencies() {
        return new ArrayList<>(resolved.values());
    }

    /**
     * Returns the graph restricted to the given services, keeping node order and every edge
     * whose ends both survive.
     */
    public DependencyGraph subgraph(Set<String> keep) {
        List<String> keptNodes = nodes.stream().filter(keep::contains).toList();
        List<DependencyEdge> keptEdges = edges.stream()
                .filter(e -> keep.contains(e.from()) && keep.contains(e.to()))
                .toList();
        Map<String, ResolvedDependency> keptResolved = new LinkedHashMap<>();
        resolved.forEach((name, dependency) -> {
            if (keep.contains(name)) {
                keptResolved.put(name, dependency);
            }
        });
        return new DependencyGraph(keptNodes, keptEdges, keptResolved);
    }

    private static Map<String, List<String>> freezeLists(Map<String, List<String>> source) {
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        source.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }

    private static Map<String, Set<String>> freezeSets(Map<String, Set<String>> source) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        source.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(frozen);
    }
}
