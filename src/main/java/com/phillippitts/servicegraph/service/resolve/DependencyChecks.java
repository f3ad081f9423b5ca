package com.phillippitts.servicegraph.service.resolve;

import com.phillippitts.servicegraph.domain.IssueCode;
import com.phillippitts.servicegraph.domain.ResolvedDependency;
import com.phillippitts.servicegraph.domain.ValidationIssue;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dependency-level rules evaluated over resolved services: unknown names, unsatisfied hard
 * requirements, conflicting services and unsatisfied optional capabilities.
 *
 * <p>Every rule runs over the whole enabled set; nothing short-circuits, so one pass surfaces
 * every problem.
 */
public final class DependencyChecks {

    private final CapabilityResolver resolver;

    public DependencyChecks(CapabilityResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Runs every dependency rule.
     *
     * @param enabled  names of every enabled service, known to the catalog or not
     * @param resolved resolved dependencies of the enabled services known to the catalog
     * @return issues in rule order, then catalog order
     */
    public List<ValidationIssue> check(Collection<String> enabled, List<ResolvedDependency> resolved) {
        List<ValidationIssue> issues = new ArrayList<>();
        issues.addAll(unknownServices(enabled));
        issues.addAll(missingRequirements(resolved));
        issues.addAll(conflicts(enabled, resolved));
        issues.addAll(missingOptionals(resolved));
        return issues;
    }

    List<ValidationIssue> unknownServices(Collection<String> enabled) {
        ServiceCatalog catalog = resolver.catalog();
        List<ValidationIssue> issues = new ArrayList<>();
        enabled.stream()
                .filter(name -> !catalog.contains(name))
                .distinct()
                .sorted()
                .forEach(name -> issues.add(ValidationIssue.of(IssueCode.UNKNOWN_SERVICE, name,
                        "Service '" + name + "' is enabled but has no entry in the service catalog")));
        return issues;
    }

    List<ValidationIssue> missingRequirements(List<ResolvedDependency> resolved) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ResolvedDependency dependency : resolved) {
            for (String capability : dependency.unsatisfiedRequires()) {
                Set<String> candidates = resolver.potentialProviders(capability);
                issues.add(ValidationIssue.of(IssueCode.MISSING_REQUIRED_CAPABILITY, dependency.service(),
                        "Service '" + dependency.service() + "' requires capability '" + capability
                                + "' but no enabled service provides it" + describeCandidates(candidates)));
            }
        }
        return issues;
    }

    List<ValidationIssue> conflicts(Collection<String> enabled, List<ResolvedDependency> resolved) {
        Comparator<String> order = resolver.catalog().registrationOrder();
        Set<String> enabledSet = new HashSet<>(enabled);
        Set<String> reportedPairs = new HashSet<>();
        List<ValidationIssue> issues = new ArrayList<>();

        for (ResolvedDependency dependency : resolved) {
            String service = dependency.service();
            for (String other : dependency.conflicts()) {
                if (other.equals(service) || !enabledSet.contains(other)) {
                    continue;
                }
                String first = order.compare(service, other) <= 0 ? service : other;
                String second = first.equals(service) ? other : service;
                if (!reportedPairs.add(first + '\u0000' + second)) {
                    continue;
                }
                issues.add(ValidationIssue.of(IssueCode.CONFLICTING_SERVICES, first,
                        "Services '" + first + "' and '" + second
                                + "' conflict with each other and cannot both be enabled"));
            }
        }
        return issues;
    }

    List<ValidationIssue> missingOptionals(List<ResolvedDependency> resolved) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ResolvedDependency dependency : resolved) {
            for (String capability : dependency.unsatisfiedOptional()) {
                Set<String> candidates = new LinkedHashSet<>(resolver.potentialProviders(capability));
                candidates.remove(dependency.service());
                String message = candidates.isEmpty()
                        ? "Service '" + dependency.service() + "' could benefit from capability '"
                                + capability + "', but no known service provides it"
                        : "Service '" + dependency.service() + "' could benefit from: "
                                + String.join(", ", candidates) + " (capability '" + capability + "')";
                issues.add(ValidationIssue.of(IssueCode.MISSING_OPTIONAL_CAPABILITY, dependency.service(), message));
            }
        }
        return issues;
    }

    private static String describeCandidates(Set<String> candidates) {
        if (candidates.isEmpty()) {
            return "";
        }
        return " (enable one of: " + String.join(", ", candidates) + ")";
    }
}
