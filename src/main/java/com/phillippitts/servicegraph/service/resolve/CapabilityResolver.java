package com.phillippitts.servicegraph.service.resolve;

import com.phillippitts.servicegraph.domain.ResolvedDependency;
import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maps required and optional capabilities of a service to the enabled services providing them.
 *
 * <p>Lookups go through the catalog's capability index rather than scanning every descriptor.
 * The resolver holds no state besides the catalog it was created for; results depend only on
 * the catalog and the enabled set passed in.
 */
public final class CapabilityResolver {

    private final ServiceCatalog catalog;

    public CapabilityResolver(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public ServiceCatalog catalog() {
        return catalog;
    }

    /**
     * Returns every enabled service whose descriptor provides the capability, in catalog order.
     * An empty set is a valid answer; the caller decides whether that is fatal.
     *
     * @param capability capability tag
     * @param enabled    names of enabled services
     * @return enabled providers
     */
    public Set<String> findProviders(String capability, Collection<String> enabled) {
        Set<String> enabledSet = Set.copyOf(enabled);
        Set<String> providers = new LinkedHashSet<>();
        for (String provider : catalog.providersOf(capability)) {
            if (enabledSet.contains(provider)) {
                providers.add(provider);
            }
        }
        return providers;
    }

    /**
     * Returns every catalog service able to provide the capability, whether enabled or not.
     */
    public Set<String> potentialProviders(String capability) {
        return catalog.providersOf(capability);
    }

    /**
     * Resolves the dependencies of one service against the enabled set.
     *
     * <p>Required capabilities map to the union of their enabled providers. A service providing
     * a capability it also requires satisfies itself without an edge to itself. {@code after}
     * entries that are not enabled are dropped; conflicts pass through unfiltered.
     *
     * @param service service to resolve (must be in the catalog)
     * @param enabled names of enabled services
     * @return resolved dependency
     */
    public ResolvedDependency resolve(String service, Collection<String> enabled) {
        ServiceDescriptor descriptor = catalog.descriptor(service);

        Set<String> requires = new LinkedHashSet<>();
        Set<String> unsatisfiedRequires = new LinkedHashSet<>();
        for (String capability : descriptor.requires()) {
            Set<String> providers = findProviders(capability, enabled);
            if (providers.isEmpty()) {
                unsatisfiedRequires.add(capability);
            }
            providers.remove(service);
            requires.addAll(providers);
        }

        Set<String> unsatisfiedOptional = new LinkedHashSet<>();
        for (String capability : descriptor.optional()) {
            if (findProviders(capability, enabled).isEmpty()) {
                unsatisfiedOptional.add(capability);
            }
        }

        Set<String> afterServices = new LinkedHashSet<>();
        for (String predecessor : descriptor.after()) {
            if (enabled.contains(predecessor) && !predecessor.equals(service)) {
                afterServices.add(predecessor);
            }
        }

        return new ResolvedDependency(
                service,
                requires,
                afterServices,
                descriptor.conflicts(),
                descriptor.provides(),
                descriptor.optional(),
                unsatisfiedRequires,
                unsatisfiedOptional);
    }

    /**
     * Resolves every enabled service known to the catalog, in catalog order.
     */
    public List<ResolvedDependency> resolveAll(Collection<String> enabled) {
        return enabled.stream()
                .filter(catalog::contains)
                .distinct()
                .sorted(catalog.registrationOrder())
                .map(service -> resolve(service, enabled))
                .toList();
    }
}
