package com.phillippitts.servicegraph.exception;

import com.phillippitts.servicegraph.domain.CyclePath;

/**
 * Thrown when a startup order is requested for a graph whose hard edges contain a cycle.
 */
public class CyclicDependencyException extends ServiceGraphException {

    private final transient CyclePath cycle;

    public CyclicDependencyException(CyclePath cycle) {
        super("Circular dependency detected: " + cycle.describe());
        this.cycle = cycle;
    }

    public CyclePath getCycle() {
        return cycle;
    }
}
