package com.phillippitts.servicegraph.service.metrics;

import com.phillippitts.servicegraph.domain.IssueCode;
import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionMetricsTest {

    private MeterRegistry registry;
    private ResolutionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ResolutionMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerSource() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(5);

        metrics.recordLatency("configured", durationNanos);

        Timer timer = registry.find("servicegraph.resolution.latency")
                .tag("source", "configured")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldCountAcceptedResolutions() {
        ResolutionReport valid = new ResolutionReport(List.of(), List.of(), List.of("a"), Map.of());

        metrics.recordOutcome("request", valid);
        metrics.recordOutcome("request", valid);

        Counter counter = registry.find("servicegraph.resolution.accepted").tag("source", "request").counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
        assertThat(registry.find("servicegraph.resolution.rejected").counter()).isNull();
    }

    @Test
    void shouldCountRejectedResolutionsAndIssuesByCode() {
        ResolutionReport invalid = new ResolutionReport(
                List.of(
                        ValidationIssue.of(IssueCode.PORT_COLLISION, "b", "port"),
                        ValidationIssue.of(IssueCode.PORT_COLLISION, "c", "port")),
                List.of(ValidationIssue.of(IssueCode.SSL_DISABLED_IN_PROD, "a", "ssl")),
                null,
                Map.of());

        metrics.recordOutcome("startup", invalid);

        assertThat(registry.find("servicegraph.resolution.rejected").tag("source", "startup").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("servicegraph.resolution.issues")
                .tag("code", "PORT_COLLISION").tag("severity", "FATAL").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("servicegraph.resolution.issues")
                .tag("code", "SSL_DISABLED_IN_PROD").tag("severity", "WARNING").counter().count())
                .isEqualTo(1.0);
    }
}
