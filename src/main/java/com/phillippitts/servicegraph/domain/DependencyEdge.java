package com.phillippitts.servicegraph.domain;

import java.util.Objects;

/**
 * Directed edge of the dependency graph, pointing from the service that must start first to
 * the service that starts after it.
 *
 * @param from provider (or soft predecessor)
 * @param to   dependent
 * @param kind {@link Kind#HARD} for capability requirements, {@link Kind#SOFT} for declared
 *             {@code after} preferences
 */
public record DependencyEdge(String from, String to, Kind kind) {

    public enum Kind { HARD, SOFT }

    public DependencyEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(kind, "kind");
    }

    public static DependencyEdge hard(String from, String to) {
        return new DependencyEdge(from, to, Kind.HARD);
    }

    public static DependencyEdge soft(String from, String to) {
        return new DependencyEdge(from, to, Kind.SOFT);
    }
}
