package com.phillippitts.servicegraph.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one resolution: blocking issues, advisory warnings, the startup order and the
 * per-service unit directives.
 *
 * <p>{@code startupOrder} is null whenever {@code fatal} is non-empty. An invalid configuration
 * never receives a partial order.
 *
 * @param fatal        fatal issues from graph resolution and field validation, merged
 * @param warnings     advisory issues
 * @param startupOrder total startup order, or null when any fatal issue exists
 * @param units        unit directives keyed by service, in catalog order
 */
public record ResolutionReport(
        List<ValidationIssue> fatal,
        List<ValidationIssue> warnings,
        List<String> startupOrder,
        Map<String, UnitDirectives> units
) {

    public ResolutionReport {
        fatal = fatal == null ? List.of() : List.copyOf(fatal);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (!fatal.isEmpty() && startupOrder != null) {
            throw new IllegalArgumentException("A report with fatal issues must not carry a startup order");
        }
        startupOrder = startupOrder == null ? null : List.copyOf(startupOrder);
        units = units == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(units));
    }

    public boolean isValid() {
        return fatal.isEmpty();
    }
}
