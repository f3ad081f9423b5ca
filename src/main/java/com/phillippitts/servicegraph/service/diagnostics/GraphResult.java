package com.phillippitts.servicegraph.service.diagnostics;

import com.phillippitts.servicegraph.domain.ValidationIssue;
import com.phillippitts.servicegraph.domain.UnitDirectives;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What graph resolution produced before aggregation: its own issues, the startup order when
 * the hard edges are acyclic, and the unit directives.
 *
 * @param issues       dependency issues (unknown, missing, conflicting, cyclic, optional)
 * @param startupOrder sorted order, or null when a cycle prevented sorting
 * @param units        unit directives keyed by service
 */
public record GraphResult(
        List<ValidationIssue> issues,
        List<String> startupOrder,
        Map<String, UnitDirectives> units
) {

    public GraphResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        startupOrder = startupOrder == null ? null : List.copyOf(startupOrder);
        units = units == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(units));
    }
}
