package com.phillippitts.servicegraph.service;

import com.phillippitts.servicegraph.domain.CyclePath;
import com.phillippitts.servicegraph.domain.IssueCode;
import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ResolvedDependency;
import com.phillippitts.servicegraph.domain.ServiceInstance;
import com.phillippitts.servicegraph.domain.UnitDirectives;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import com.phillippitts.servicegraph.exception.InvalidServiceConfigurationException;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;
import com.phillippitts.servicegraph.service.diagnostics.DiagnosticsAggregator;
import com.phillippitts.servicegraph.service.diagnostics.GraphResult;
import com.phillippitts.servicegraph.service.graph.CycleDetector;
import com.phillippitts.servicegraph.service.graph.DependencyGraph;
import com.phillippitts.servicegraph.service.graph.DependencyGraphBuilder;
import com.phillippitts.servicegraph.service.graph.TopologicalSorter;
import com.phillippitts.servicegraph.service.resolve.CapabilityResolver;
import com.phillippitts.servicegraph.service.resolve.DependencyChecks;
import com.phillippitts.servicegraph.service.validation.CrossServiceValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one full resolution: capability matching, graph construction, cycle detection,
 * topological sort and cross-service validation, aggregated into a {@link ResolutionReport}.
 *
 * <p>The catalog and the enabled instances are explicit parameters of every call and the graph
 * is rebuilt each time, so a call is a pure function of its input: identical input yields an
 * equal report with identical ordering. Safe to call from several threads.
 */
@Component
public class ResolutionEngine {

    private static final Logger LOG = LogManager.getLogger(ResolutionEngine.class);

    private final CrossServiceValidator validator;
    private final CycleDetector cycleDetector = new CycleDetector();
    private final TopologicalSorter sorter = new TopologicalSorter(cycleDetector);
    private final DiagnosticsAggregator aggregator = new DiagnosticsAggregator();

    public ResolutionEngine(CrossServiceValidator validator) {
        this.validator = validator;
    }

    /**
     * Resolves the enabled services against the catalog.
     *
     * @param catalog   known service descriptors
     * @param instances enabled service instances, in any order
     * @return report with fatal issues, warnings, startup order (null when anything is fatal)
     *         and unit directives
     * @throws InvalidServiceConfigurationException if a service name appears more than once
     */
    public ResolutionReport resolve(ServiceCatalog catalog, Collection<ServiceInstance> instances) {
        List<ServiceInstance> ordered = orderedInstances(catalog, instances);
        List<String> enabled = ordered.stream().map(ServiceInstance::name).toList();

        CapabilityResolver resolver = new CapabilityResolver(catalog);
        DependencyGraph graph = new DependencyGraphBuilder(resolver).build(enabled);

        List<ValidationIssue> graphIssues =
                new ArrayList<>(new DependencyChecks(resolver).check(enabled, graph.resolvedDependencies()));

        List<String> order = null;
        Optional<CyclePath> cycle = cycleDetector.detectCycle(graph);
        if (cycle.isPresent()) {
            CyclePath path = cycle.get();
            LOG.warn("Dependency cycle among enabled services: {}", path.describe());
            graphIssues.add(ValidationIssue.of(IssueCode.CYCLIC_DEPENDENCY, path.first(),
                    "Circular dependency detected: " + path.describe()));
        } else {
            order = sorter.sort(graph);
        }

        GraphResult graphResult = new GraphResult(graphIssues, order, unitDirectives(graph));
        List<ValidationIssue> validationIssues = validator.validate(ordered);

        ResolutionReport report = aggregator.aggregate(graphResult, validationIssues);
        LOG.debug("Resolved {} services: fatal={}, warnings={}",
                enabled.size(), report.fatal().size(), report.warnings().size());
        return report;
    }

    /**
     * Derives supervision directives from a resolved graph: {@code wants} lists the hard
     * providers, {@code after} lists hard providers followed by soft predecessors, and
     * {@code conflicts} passes declared conflicts through.
     */
    static Map<String, UnitDirectives> unitDirectives(DependencyGraph graph) {
        Map<String, UnitDirectives> units = new LinkedHashMap<>();
        for (ResolvedDependency dependency : graph.resolvedDependencies()) {
            Set<String> after = new LinkedHashSet<>(dependency.requires());
            after.addAll(dependency.afterServices());
            units.put(dependency.service(), new UnitDirectives(
                    List.copyOf(dependency.requires()),
                    List.copyOf(after),
                    List.copyOf(dependency.conflicts())));
        }
        return units;
    }

    private static List<ServiceInstance> orderedInstances(ServiceCatalog catalog,
                                                          Collection<ServiceInstance> instances) {
        Set<String> names = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (ServiceInstance instance : instances) {
            if (!names.add(instance.name())) {
                duplicates.add(instance.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new InvalidServiceConfigurationException(
                    "service names must be unique, duplicated: " + String.join(", ", duplicates));
        }
        List<ServiceInstance> ordered = new ArrayList<>(instances);
        ordered.sort((a, b) -> catalog.registrationOrder().compare(a.name(), b.name()));
        return ordered;
    }
}
