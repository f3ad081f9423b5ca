package com.phillippitts.servicegraph.service.graph;

import com.phillippitts.servicegraph.domain.CyclePath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Depth-first search for a cycle among hard edges.
 *
 * <p>Starts from each unvisited node in graph order and keeps the current path. Reaching a node
 * that is still on the path closes a cycle; the search stops at the first one. Finished nodes
 * are never descended into again, so the search is O(V+E).
 *
 * <p>Stateless and thread-safe.
 */
public final class CycleDetector {

    private enum Mark { ON_PATH, DONE }

    /**
     * Finds the first cycle in the graph.
     *
     * @param graph graph to inspect
     * @return the cycle, from the first occurrence of the revisited service through the service
     *         that closes it, or empty when the hard edges are acyclic
     */
    public Optional<CyclePath> detectCycle(DependencyGraph graph) {
        Map<String, Mark> marks = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (String node : graph.nodes()) {
            if (marks.containsKey(node)) {
                continue;
            }
            Optional<CyclePath> cycle = visit(node, graph, marks, path);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    private Optional<CyclePath> visit(String node,
                                      DependencyGraph graph,
                                      Map<String, Mark> marks,
                                      List<String> path) {
        marks.put(node, Mark.ON_PATH);
        path.add(node);

        for (String next : graph.hardSuccessors(node)) {
            Mark mark = marks.get(next);
            if (mark == Mark.ON_PATH) {
                return Optional.of(new CyclePath(path.subList(path.indexOf(next), path.size())));
            }
            if (mark == null) {
                Optional<CyclePath> cycle = visit(next, graph, marks, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }

        path.remove(path.size() - 1);
        marks.put(node, Mark.DONE);
        return Optional.empty();
    }
}
