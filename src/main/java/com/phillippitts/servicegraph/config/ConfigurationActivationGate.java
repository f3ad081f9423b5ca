package com.phillippitts.servicegraph.config;

import com.phillippitts.servicegraph.config.properties.ServiceGraphProperties;
import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import com.phillippitts.servicegraph.exception.ConfigurationRejectedException;
import com.phillippitts.servicegraph.service.ResolutionService;
import com.phillippitts.servicegraph.service.diagnostics.ReportFormatter;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Resolves the configured service set at startup and refuses to activate a configuration with
 * fatal issues.
 *
 * Fail-fast: with {@code servicegraph.activation.fail-on-fatal=true} (the default) startup is
 * aborted with a {@link ConfigurationRejectedException} listing every fatal issue at once.
 * Warnings are logged and never block.
 */
@Component
@ConditionalOnProperty(name = "servicegraph.activation.enabled", havingValue = "true", matchIfMissing = true)
class ConfigurationActivationGate {

    private static final Logger LOG = LogManager.getLogger(ConfigurationActivationGate.class);

    private final ResolutionService resolutionService;
    private final ServiceGraphProperties properties;

    ConfigurationActivationGate(ResolutionService resolutionService, ServiceGraphProperties properties) {
        this.resolutionService = resolutionService;
        this.properties = properties;
    }

    @PostConstruct
    void activate() {
        ResolutionReport report = resolutionService.resolveAtStartup();
        for (ValidationIssue warning : report.warnings()) {
            LOG.warn("[{}] {}", warning.code(), warning.message());
        }

        if (report.isValid()) {
            LOG.info("Activating services in order: {}", report.startupOrder());
            return;
        }

        String rendered = ReportFormatter.format(report);
        if (properties.getActivation().isFailOnFatal()) {
            throw new ConfigurationRejectedException(rendered, report);
        }
        LOG.error("{}\nContinuing because servicegraph.activation.fail-on-fatal=false", rendered);
    }
}
