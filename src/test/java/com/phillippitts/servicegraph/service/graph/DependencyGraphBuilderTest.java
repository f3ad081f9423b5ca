package com.phillippitts.servicegraph.service.graph;

import com.phillippitts.servicegraph.domain.DependencyEdge;
import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.service.catalog.BuiltInCatalog;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;
import com.phillippitts.servicegraph.service.resolve.CapabilityResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphBuilderTest {

    @Test
    void hardEdgesPointFromProviderToDependent() {
        DependencyGraph graph = new DependencyGraphBuilder(new CapabilityResolver(BuiltInCatalog.catalog()))
                .build(List.of("gitea", "postgres"));

        assertThat(graph.nodes()).containsExactly("postgres", "gitea");
        assertThat(graph.hardEdges()).containsExactly(DependencyEdge.hard("postgres", "gitea"));
        assertThat(graph.hardSuccessors("postgres")).containsExactly("gitea");
        assertThat(graph.hardPredecessors("gitea")).containsExactly("postgres");
    }

    @Test
    void softEdgesAreKeptApart() {
        DependencyGraph graph = new DependencyGraphBuilder(new CapabilityResolver(BuiltInCatalog.catalog()))
                .build(List.of("gitea", "postgres"));

        assertThat(graph.edges()).contains(DependencyEdge.soft("postgres", "gitea"));
        assertThat(graph.softPredecessors("gitea")).containsExactly("postgres");
    }

    @Test
    void multipleProvidersAllBecomeHardPredecessors() {
        ServiceCatalog catalog = ServiceCatalog.of(
                ServiceDescriptor.builder("pg").provides("db").build(),
                ServiceDescriptor.builder("mysql").provides("db").build(),
                ServiceDescriptor.builder("app").requires("db").build());

        DependencyGraph graph = new DependencyGraphBuilder(new CapabilityResolver(catalog))
                .build(List.of("app", "mysql", "pg"));

        assertThat(graph.hardPredecessors("app")).containsExactly("pg", "mysql");
    }

    @Test
    void unknownServicesAreNotNodes() {
        DependencyGraph graph = new DependencyGraphBuilder(new CapabilityResolver(BuiltInCatalog.catalog()))
                .build(List.of("postgres", "gitlab"));

        assertThat(graph.nodes()).containsExactly("postgres");
        assertThat(graph.resolved("postgres")).isPresent();
        assertThat(graph.resolved("gitlab")).isEmpty();
    }
}
