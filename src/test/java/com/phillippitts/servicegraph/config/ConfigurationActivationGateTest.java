package com.phillippitts.servicegraph.config;

import com.phillippitts.servicegraph.config.properties.ServiceGraphProperties;
import com.phillippitts.servicegraph.domain.IssueCode;
import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import com.phillippitts.servicegraph.exception.ConfigurationRejectedException;
import com.phillippitts.servicegraph.service.ResolutionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfigurationActivationGateTest {

    private static final ResolutionReport INVALID = new ResolutionReport(
            List.of(
                    ValidationIssue.of(IssueCode.PORT_COLLISION, "b",
                            "Port 3000 is already used by service 'a', cannot assign to 'b'"),
                    ValidationIssue.of(IssueCode.MISSING_REQUIRED_CAPABILITY, "a",
                            "Service 'a' requires capability 'cache' but no enabled service provides it")),
            List.of(),
            null,
            Map.of());

    private ResolutionService resolutionService;

    @BeforeEach
    void setUp() {
        resolutionService = mock(ResolutionService.class);
    }

    private static ServiceGraphProperties properties(boolean failOnFatal) {
        return new ServiceGraphProperties(null, null, new ServiceGraphProperties.Activation(true, failOnFatal));
    }

    @Test
    void acceptsValidConfiguration() {
        when(resolutionService.resolveAtStartup()).thenReturn(new ResolutionReport(
                List.of(),
                List.of(ValidationIssue.of(IssueCode.SSL_DISABLED_IN_PROD, "a", "ssl off")),
                List.of("a"),
                Map.of()));
        ConfigurationActivationGate gate = new ConfigurationActivationGate(resolutionService, properties(true));

        assertThatCode(gate::activate).doesNotThrowAnyException();
        verify(resolutionService).resolveAtStartup();
    }

    @Test
    void rejectsFatalConfigurationListingEveryIssue() {
        when(resolutionService.resolveAtStartup()).thenReturn(INVALID);
        ConfigurationActivationGate gate = new ConfigurationActivationGate(resolutionService, properties(true));

        assertThatThrownBy(gate::activate)
                .isInstanceOf(ConfigurationRejectedException.class)
                .hasMessageContaining("Service configuration validation failed:")
                .hasMessageContaining("[PORT_COLLISION] b")
                .hasMessageContaining("[MISSING_REQUIRED_CAPABILITY] a")
                .satisfies(ex -> {
                    ConfigurationRejectedException rejected = (ConfigurationRejectedException) ex;
                    assertThat(rejected.getFatalCount()).isEqualTo(2);
                    assertThat(rejected.getReport()).isSameAs(INVALID);
                });
    }

    @Test
    void logsInsteadOfFailingWhenFailOnFatalDisabled() {
        when(resolutionService.resolveAtStartup()).thenReturn(INVALID);
        ConfigurationActivationGate gate = new ConfigurationActivationGate(resolutionService, properties(false));

        assertThatCode(gate::activate).doesNotThrowAnyException();
    }
}
