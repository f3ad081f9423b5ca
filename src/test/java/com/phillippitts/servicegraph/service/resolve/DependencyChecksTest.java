package com.phillippitts.servicegraph.service.resolve;

import com.phillippitts.servicegraph.domain.IssueCode;
import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import com.phillippitts.servicegraph.service.catalog.BuiltInCatalog;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyChecksTest {

    private static List<ValidationIssue> check(ServiceCatalog catalog, List<String> enabled) {
        CapabilityResolver resolver = new CapabilityResolver(catalog);
        return new DependencyChecks(resolver).check(enabled, resolver.resolveAll(enabled));
    }

    @Test
    void missingRequirementNamesServiceCapabilityAndCandidates() {
        List<ValidationIssue> issues = check(BuiltInCatalog.catalog(), List.of("gitea"));

        assertThat(issues).filteredOn(ValidationIssue::isFatal).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.MISSING_REQUIRED_CAPABILITY);
            assertThat(issue.service()).isEqualTo("gitea");
            assertThat(issue.message())
                    .isEqualTo("Service 'gitea' requires capability 'database.postgres' but no enabled "
                            + "service provides it (enable one of: postgres)");
        });
    }

    @Test
    void missingRequirementWithoutAnyCandidateOmitsHint() {
        ServiceCatalog catalog = ServiceCatalog.of(ServiceDescriptor.builder("A").requires("x").build());

        List<ValidationIssue> issues = check(catalog, List.of("A"));

        assertThat(issues).extracting(ValidationIssue::message)
                .containsExactly("Service 'A' requires capability 'x' but no enabled service provides it");
    }

    @Test
    void conflictReportedOncePerPairAndAttributedToCatalogFirst() {
        List<ValidationIssue> issues = check(BuiltInCatalog.catalog(), List.of("nginx", "traefik"));

        assertThat(issues).filteredOn(i -> i.code() == IssueCode.CONFLICTING_SERVICES)
                .singleElement()
                .satisfies(issue -> {
                    assertThat(issue.service()).isEqualTo("traefik");
                    assertThat(issue.message()).contains("'traefik'").contains("'nginx'");
                });
    }

    @Test
    void oneSidedConflictDeclarationIsEnough() {
        ServiceCatalog catalog = ServiceCatalog.of(
                ServiceDescriptor.builder("A").build(),
                ServiceDescriptor.builder("B").conflicts("A").build());

        List<ValidationIssue> issues = check(catalog, List.of("A", "B"));

        assertThat(issues).extracting(ValidationIssue::code).containsExactly(IssueCode.CONFLICTING_SERVICES);
        assertThat(issues.get(0).service()).isEqualTo("A");
    }

    @Test
    void conflictWithDisabledServiceIsIgnored() {
        List<ValidationIssue> issues = check(BuiltInCatalog.catalog(), List.of("traefik"));

        assertThat(issues).isEmpty();
    }

    @Test
    void optionalCapabilityWarningListsCatalogProviders() {
        List<ValidationIssue> issues = check(BuiltInCatalog.catalog(), List.of("postgres", "gitea"));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.MISSING_OPTIONAL_CAPABILITY);
            assertThat(issue.isFatal()).isFalse();
            assertThat(issue.message()).isEqualTo(
                    "Service 'gitea' could benefit from: traefik, haproxy, nginx (capability 'reverse_proxy')");
        });
    }

    @Test
    void optionalCapabilityWithNoKnownProvider() {
        ServiceCatalog catalog = ServiceCatalog.of(ServiceDescriptor.builder("A").optional("tracing").build());

        List<ValidationIssue> issues = check(catalog, List.of("A"));

        assertThat(issues).extracting(ValidationIssue::message).containsExactly(
                "Service 'A' could benefit from capability 'tracing', but no known service provides it");
    }

    @Test
    void unknownServiceIsFatal() {
        List<ValidationIssue> issues = check(BuiltInCatalog.catalog(), List.of("postgres", "gitlab"));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.UNKNOWN_SERVICE);
            assertThat(issue.service()).isEqualTo("gitlab");
        });
    }

    @Test
    void issuesComeInRuleOrder() {
        List<ValidationIssue> issues = check(BuiltInCatalog.catalog(),
                List.of("gitea", "traefik", "nginx", "gitlab"));

        assertThat(issues).extracting(ValidationIssue::code).containsExactly(
                IssueCode.UNKNOWN_SERVICE,
                IssueCode.MISSING_REQUIRED_CAPABILITY,
                IssueCode.CONFLICTING_SERVICES);
    }
}
