package com.phillippitts.servicegraph.domain;

import java.util.List;

/**
 * Ordering and negative constraints handed to the process-supervision layer for one service.
 *
 * @param wants     services to pull in alongside this one (hard providers)
 * @param after     services to start before this one (hard providers, then soft predecessors)
 * @param conflicts services that must not run alongside this one
 */
public record UnitDirectives(List<String> wants, List<String> after, List<String> conflicts) {

    public UnitDirectives {
        wants = wants == null ? List.of() : List.copyOf(wants);
        after = after == null ? List.of() : List.copyOf(after);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }
}
