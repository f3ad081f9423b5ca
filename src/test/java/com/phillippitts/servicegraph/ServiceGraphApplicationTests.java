package com.phillippitts.servicegraph;

import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.service.ResolutionService;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest
class ServiceGraphApplicationTests {

    @Autowired
    private ResolutionService resolutionService;

    @Test
    void contextLoads() {
    }

    @Test
    void shippedConfigurationIsAccepted() {
        ResolutionReport report = resolutionService.resolveConfigured();

        assertThat(report.isValid()).isTrue();
        assertThat(report.startupOrder()).containsExactly("postgres", "gitea", "traefik");
        assertThat(report.warnings()).isEmpty();
    }
}
