package com.phillippitts.servicegraph.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a known service: which capabilities it provides and requires, which
 * services it prefers to start after, and which services it cannot run alongside.
 *
 * <p>All sets keep their declaration order so that anything derived from a descriptor iterates
 * deterministically. Descriptors are defined once when the catalog is built and never mutated.
 *
 * @param name      unique service name (e.g., "gitea")
 * @param provides  capabilities this service offers to others
 * @param requires  capabilities that must be provided by an enabled service (hard dependency)
 * @param after     service names this service prefers to start after (soft ordering only)
 * @param conflicts service names that must not be enabled together with this service
 * @param optional  capabilities this service can use when present
 */
public record ServiceDescriptor(
        String name,
        Set<String> provides,
        Set<String> requires,
        Set<String> after,
        Set<String> conflicts,
        Set<String> optional
) {

    public ServiceDescriptor {
        Objects.requireNonNull(name, "Service name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        provides = copyOf(provides);
        requires = copyOf(requires);
        after = copyOf(after);
        conflicts = copyOf(conflicts);
        optional = copyOf(optional);
    }

    /**
     * Starts a fluent descriptor definition.
     *
     * @param name service name (must not be blank)
     * @return new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    /**
     * Fluent builder used by the built-in catalog and by tests.
     */
    public static final class Builder {

        private final String name;
        private final Set<String> provides = new LinkedHashSet<>();
        private final Set<String> requires = new LinkedHashSet<>();
        private final Set<String> after = new LinkedHashSet<>();
        private final Set<String> conflicts = new LinkedHashSet<>();
        private final Set<String> optional = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder provides(String... capabilities) {
            provides.addAll(Arrays.asList(capabilities));
            return this;
        }

        public Builder requires(String... capabilities) {
            requires.addAll(Arrays.asList(capabilities));
            return this;
        }

        public Builder after(String... services) {
            after.addAll(Arrays.asList(services));
            return this;
        }

        public Builder conflicts(String... services) {
            conflicts.addAll(Arrays.asList(services));
            return this;
        }

        public Builder optional(String... capabilities) {
            optional.addAll(Arrays.asList(capabilities));
            return this;
        }

        public ServiceDescriptor build() {
            return new ServiceDescriptor(name, provides, requires, after, conflicts, optional);
        }
    }
}
