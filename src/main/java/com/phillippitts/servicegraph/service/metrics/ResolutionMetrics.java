package com.phillippitts.servicegraph.service.metrics;

import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for service-graph resolutions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Resolution latency, tagged by source: {@code startup} for activation, {@code configured}
 *       and {@code request} for the REST API</li>
 *   <li>Accepted and rejected resolution counts</li>
 *   <li>Issue counts per issue code and severity</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ResolutionMetrics {

    private static final String METRIC_PREFIX = "servicegraph.resolution";

    private final MeterRegistry registry;

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one resolution took.
     *
     * @param source what triggered the resolution
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String source, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to resolve and validate a service set")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts the outcome of a resolution and each issue it reported.
     *
     * @param source what triggered the resolution
     * @param report the resolution result
     */
    public void recordOutcome(String source, ResolutionReport report) {
        Counter.builder(METRIC_PREFIX + (report.isValid() ? ".accepted" : ".rejected"))
                .description(report.isValid()
                        ? "Number of resolutions without fatal issues"
                        : "Number of resolutions with at least one fatal issue")
                .tag("source", source)
                .register(registry)
                .increment();
        for (ValidationIssue issue : report.fatal()) {
            incrementIssue(issue);
        }
        for (ValidationIssue issue : report.warnings()) {
            incrementIssue(issue);
        }
    }

    private void incrementIssue(ValidationIssue issue) {
        Counter.builder(METRIC_PREFIX + ".issues")
                .description("Number of reported issues by code")
                .tag("code", issue.code().name())
                .tag("severity", issue.severity().name())
                .register(registry)
                .increment();
    }
}
