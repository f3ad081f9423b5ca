package com.phillippitts.servicegraph.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Dependencies of one enabled service after matching its capabilities against the enabled set.
 *
 * @param service             service name
 * @param requires            enabled services providing its required capabilities
 * @param afterServices       declared {@code after} services that are enabled
 * @param conflicts           declared conflicts, not filtered by enablement
 * @param provides            capabilities the service provides
 * @param optional            declared optional capabilities
 * @param unsatisfiedRequires required capabilities with no enabled provider
 * @param unsatisfiedOptional optional capabilities with no enabled provider
 */
public record ResolvedDependency(
        String service,
        Set<String> requires,
        Set<String> afterServices,
        Set<String> conflicts,
        Set<String> provides,
        Set<String> optional,
        Set<String> unsatisfiedRequires,
        Set<String> unsatisfiedOptional
) {

    public ResolvedDependency {
        Objects.requireNonNull(service, "service");
        requires = copyOf(requires);
        afterServices = copyOf(afterServices);
        conflicts = copyOf(conflicts);
        provides = copyOf(provides);
        optional = copyOf(optional);
        unsatisfiedRequires = copyOf(unsatisfiedRequires);
        unsatisfiedOptional = copyOf(unsatisfiedOptional);
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
