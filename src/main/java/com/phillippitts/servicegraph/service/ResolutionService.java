package com.phillippitts.servicegraph.service;

import com.phillippitts.servicegraph.config.properties.ServiceGraphProperties;
import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.domain.ServiceInstance;
import com.phillippitts.servicegraph.domain.UnitDirectives;
import com.phillippitts.servicegraph.exception.UnknownServiceException;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;
import com.phillippitts.servicegraph.service.diagnostics.ReportFormatter;
import com.phillippitts.servicegraph.service.metrics.ResolutionMetrics;
import com.phillippitts.servicegraph.service.resolve.DependencyExpander;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Application-facing entry point: resolves the configured service set or a caller-supplied one
 * against the effective catalog.
 *
 * <p>Startup activation and API resolutions are recorded in {@link ResolutionMetrics}, tagged by
 * source. Health checks and unit-directive lookups use {@link #inspectConfigured()}, which is not
 * recorded.
 */
@Service
public class ResolutionService {

    private static final Logger LOG = LogManager.getLogger(ResolutionService.class);

    static final String SOURCE_STARTUP = "startup";
    static final String SOURCE_CONFIGURED = "configured";
    static final String SOURCE_REQUEST = "request";

    private final ResolutionEngine engine;
    private final ServiceCatalog catalog;
    private final ServiceGraphProperties properties;
    private final DependencyExpander expander;
    private final ResolutionMetrics metrics;

    public ResolutionService(ResolutionEngine engine,
                             ServiceCatalog catalog,
                             ServiceGraphProperties properties,
                             DependencyExpander expander,
                             ResolutionMetrics metrics) {
        this.engine = engine;
        this.catalog = catalog;
        this.properties = properties;
        this.expander = expander;
        this.metrics = metrics;
    }

    /**
     * Resolves the services enabled under {@code servicegraph.services} on behalf of an API caller.
     */
    public ResolutionReport resolveConfigured() {
        return resolve(SOURCE_CONFIGURED, properties.enabledInstances());
    }

    /**
     * Resolves the configured services once, before activation.
     */
    public ResolutionReport resolveAtStartup() {
        return resolve(SOURCE_STARTUP, properties.enabledInstances());
    }

    /**
     * Resolves the configured services without recording metrics.
     */
    public ResolutionReport inspectConfigured() {
        return engine.resolve(catalog, properties.enabledInstances());
    }

    /**
     * Resolves an arbitrary set of instances against the effective catalog.
     */
    public ResolutionReport resolve(Collection<ServiceInstance> instances) {
        return resolve(SOURCE_REQUEST, instances);
    }

    /**
     * Unit directives of one configured, enabled service.
     *
     * @throws UnknownServiceException if the service is not enabled or not in the catalog
     */
    public UnitDirectives directivesFor(String service) {
        UnitDirectives directives = inspectConfigured().units().get(service);
        if (directives == null) {
            throw new UnknownServiceException(service, "not an enabled catalog service");
        }
        return directives;
    }

    /**
     * Suggested service set that satisfies every hard requirement of {@code requested}.
     * Read-only: the configured set is never changed.
     */
    public List<String> closure(Collection<String> requested) {
        return expander.expand(requested);
    }

    public List<ServiceDescriptor> catalog() {
        return catalog.descriptors();
    }

    private ResolutionReport resolve(String source, Collection<ServiceInstance> instances) {
        long start = System.nanoTime();
        ResolutionReport report = engine.resolve(catalog, instances);
        metrics.recordLatency(source, System.nanoTime() - start);
        metrics.recordOutcome(source, report);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Resolution [{}]: {}", source, ReportFormatter.summary(report));
        }
        return report;
    }
}
