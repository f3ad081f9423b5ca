package com.phillippitts.servicegraph.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Services forming a dependency cycle, in traversal order. The edge from the last service back
 * to the first closes the cycle and is not repeated in {@link #services()}.
 *
 * @param services services on the cycle, starting with the first one revisited
 */
public record CyclePath(List<String> services) {

    private static final String ARROW = " → ";

    public CyclePath {
        if (services == null || services.isEmpty()) {
            throw new IllegalArgumentException("Cycle path must contain at least one service");
        }
        services = List.copyOf(services);
    }

    public String first() {
        return services.get(0);
    }

    /**
     * Renders the cycle closed on its first service, e.g. {@code a → b → c → a}.
     */
    public String describe() {
        List<String> closed = new ArrayList<>(services);
        closed.add(first());
        return String.join(ARROW, closed);
    }
}
