package com.phillippitts.servicegraph.config;

import com.phillippitts.servicegraph.config.properties.ServiceGraphProperties;
import com.phillippitts.servicegraph.service.catalog.BuiltInCatalog;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;
import com.phillippitts.servicegraph.service.resolve.DependencyExpander;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine's plain-Java collaborators that depend on configuration.
 */
@Configuration
public class ServiceGraphConfig {

    private static final Logger LOG = LogManager.getLogger(ServiceGraphConfig.class);

    /**
     * Built-in catalog with the {@code servicegraph.catalog} entries applied on top.
     */
    @Bean
    public ServiceCatalog serviceCatalog(ServiceGraphProperties properties) {
        ServiceCatalog catalog = BuiltInCatalog.catalog().withOverrides(properties.catalogOverrides());
        LOG.info("Service catalog ready: {} services ({} configured overrides)",
                catalog.size(), properties.getCatalog().size());
        return catalog;
    }

    @Bean
    public DependencyExpander dependencyExpander(ServiceCatalog serviceCatalog) {
        return new DependencyExpander(serviceCatalog);
    }
}
