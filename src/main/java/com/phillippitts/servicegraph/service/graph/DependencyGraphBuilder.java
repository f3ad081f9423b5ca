package com.phillippitts.servicegraph.service.graph;

import com.phillippitts.servicegraph.domain.DependencyEdge;
import com.phillippitts.servicegraph.domain.ResolvedDependency;
import com.phillippitts.servicegraph.service.resolve.CapabilityResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns resolved capability links and declared soft orderings into a {@link DependencyGraph}.
 *
 * <p>The graph is computed fresh on every call from the enabled set passed in. Enabled services
 * missing from the catalog are left out of the graph; they are reported separately.
 */
public final class DependencyGraphBuilder {

    private static final Logger LOG = LogManager.getLogger(DependencyGraphBuilder.class);

    private final CapabilityResolver resolver;

    public DependencyGraphBuilder(CapabilityResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Builds the graph for the enabled services.
     *
     * @param enabled names of enabled services
     * @return graph whose nodes are the enabled catalog services in registration order
     */
    public DependencyGraph build(Collection<String> enabled) {
        List<ResolvedDependency> resolved = resolver.resolveAll(enabled);

        List<String> nodes = new ArrayList<>();
        List<DependencyEdge> edges = new ArrayList<>();
        Map<String, ResolvedDependency> byName = new LinkedHashMap<>();
        for (ResolvedDependency dependency : resolved) {
            nodes.add(dependency.service());
            byName.put(dependency.service(), dependency);
        }
        for (ResolvedDependency dependency : resolved) {
            for (String provider : dependency.requires()) {
                edges.add(DependencyEdge.hard(provider, dependency.service()));
            }
            for (String predecessor : dependency.afterServices()) {
                edges.add(DependencyEdge.soft(predecessor, dependency.service()));
            }
        }

        DependencyGraph graph = DependencyGraph.of(nodes, edges, byName);
        LOG.debug("Built dependency graph: nodes={}, hardEdges={}, softEdges={}",
                nodes.size(), graph.hardEdges().size(), graph.edges().size() - graph.hardEdges().size());
        return graph;
    }
}
