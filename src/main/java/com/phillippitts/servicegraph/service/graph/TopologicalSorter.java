package com.phillippitts.servicegraph.service.graph;

import com.phillippitts.servicegraph.domain.CyclePath;
import com.phillippitts.servicegraph.exception.CyclicDependencyException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Kahn's algorithm over hard edges, producing the service startup order.
 *
 * <p>The ready set is ordered by graph node order (catalog registration order). Soft edges only
 * break ties: among ready services, the first whose soft predecessors have all been placed is
 * taken, and when none qualifies the first ready service is taken anyway. Soft edges therefore
 * never make a sort fail.
 *
 * <p>Stateless and thread-safe.
 */
public final class TopologicalSorter {

    private final CycleDetector cycleDetector;

    public TopologicalSorter(CycleDetector cycleDetector) {
        this.cycleDetector = cycleDetector;
    }

    public TopologicalSorter() {
        this(new CycleDetector());
    }

    /**
     * Sorts the graph so that every service comes after all of its hard providers.
     *
     * @param graph graph to sort
     * @return startup order over all nodes
     * @throws CyclicDependencyException if the hard edges contain a cycle; the exception carries
     *         the same path shape as {@link CycleDetector#detectCycle}
     */
    public List<String> sort(DependencyGraph graph) {
        List<String> nodes = graph.nodes();
        Map<String, Integer> position = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            String node = nodes.get(i);
            position.put(node, i);
            inDegree.put(node, graph.hardPredecessors(node).size());
        }

        TreeSet<String> ready = new TreeSet<>((a, b) -> Integer.compare(position.get(a), position.get(b)));
        for (String node : nodes) {
            if (inDegree.get(node) == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>(nodes.size());
        Set<String> placed = new HashSet<>();
        while (!ready.isEmpty()) {
            String current = nextReady(ready, placed, graph);
            ready.remove(current);
            order.add(current);
            placed.add(current);

            for (String successor : graph.hardSuccessors(current)) {
                int remaining = inDegree.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(successor);
                }
            }
        }

        if (order.size() < nodes.size()) {
            Set<String> unplaced = new LinkedHashSet<>(nodes);
            unplaced.removeAll(placed);
            CyclePath cycle = cycleDetector.detectCycle(graph.subgraph(unplaced))
                    .orElseThrow(() -> new IllegalStateException(
                            "Sort stalled without a detectable cycle among " + unplaced));
            throw new CyclicDependencyException(cycle);
        }
        return order;
    }

    private static String nextReady(TreeSet<String> ready, Set<String> placed, DependencyGraph graph) {
        for (String candidate : ready) {
            if (placed.containsAll(graph.softPredecessors(candidate))) {
                return candidate;
            }
        }
        return ready.first();
    }
}
