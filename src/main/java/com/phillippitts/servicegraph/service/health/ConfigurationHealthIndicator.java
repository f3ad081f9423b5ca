package com.phillippitts.servicegraph.service.health;

import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.service.ResolutionService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the configured service set.
 *
 * <p>UP when the configuration resolves without fatal issues, with the startup order as detail;
 * DOWN with fatal and warning counts otherwise.
 *
 * <p>Exposed via /actuator/health as {@code serviceConfiguration}.
 */
@Component("serviceConfiguration")
public class ConfigurationHealthIndicator implements HealthIndicator {

    private final ResolutionService resolutionService;

    public ConfigurationHealthIndicator(ResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @Override
    public Health health() {
        ResolutionReport report = resolutionService.inspectConfigured();
        Health.Builder builder = new Health.Builder();

        if (report.isValid()) {
            builder.up()
                    .withDetail("status", "Configuration resolves without fatal issues")
                    .withDetail("startupOrder", report.startupOrder());
        } else {
            builder.down()
                    .withDetail("status", "Configuration has fatal issues")
                    .withDetail("fatal", report.fatal().size());
        }
        return builder.withDetail("warnings", report.warnings().size()).build();
    }
}
