package com.phillippitts.servicegraph.service.catalog;

import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.exception.UnknownServiceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of known services, keyed by name.
 *
 * <p>Registration order is significant: it is the stable tie-break used wherever several valid
 * choices exist (queue seeding in the topological sort, provider listing, report ordering), so
 * identical input always produces identical output.
 *
 * <p>Thread-safe: instances are never mutated after construction.
 */
public final class ServiceCatalog {

    private final Map<String, ServiceDescriptor> descriptors;
    private final Map<String, Integer> registrationIndex;
    private final CapabilityIndex capabilityIndex;

    private ServiceCatalog(Map<String, ServiceDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(descriptors);
        Map<String, Integer> index = new LinkedHashMap<>();
        int position = 0;
        for (String name : descriptors.keySet()) {
            index.put(name, position++);
        }
        this.registrationIndex = Collections.unmodifiableMap(index);
        this.capabilityIndex = new CapabilityIndex(descriptors.values());
    }

    /**
     * Creates a catalog from descriptors in registration order.
     *
     * @param descriptors descriptors; names must be unique
     * @return new catalog
     * @throws IllegalArgumentException if two descriptors share a name
     */
    public static ServiceCatalog of(Collection<ServiceDescriptor> descriptors) {
        Map<String, ServiceDescriptor> byName = new LinkedHashMap<>();
        for (ServiceDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate service descriptor: " + descriptor.name());
            }
        }
        return new ServiceCatalog(byName);
    }

    public static ServiceCatalog of(ServiceDescriptor... descriptors) {
        return of(List.of(descriptors));
    }

    /**
     * Returns a new catalog where each override replaces the descriptor of the same name in
     * place, and unknown names are appended in the order given.
     */
    public ServiceCatalog withOverrides(Collection<ServiceDescriptor> overrides) {
        Map<String, ServiceDescriptor> merged = new LinkedHashMap<>(descriptors);
        for (ServiceDescriptor override : overrides) {
            merged.put(override.name(), override);
        }
        return new ServiceCatalog(merged);
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    public Optional<ServiceDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    /**
     * Returns the descriptor for a known service.
     *
     * @throws UnknownServiceException if the name is not registered
     */
    public ServiceDescriptor descriptor(String name) {
        ServiceDescriptor descriptor = descriptors.get(name);
        if (descriptor == null) {
            throw new UnknownServiceException(name, "not in service catalog");
        }
        return descriptor;
    }

    /** Service names in registration order. */
    public Set<String> names() {
        return descriptors.keySet();
    }

    /** Descriptors in registration order. */
    public List<ServiceDescriptor> descriptors() {
        return new ArrayList<>(descriptors.values());
    }

    public int size() {
        return descriptors.size();
    }

    /** Every catalog service providing the capability, enabled or not, in registration order. */
    public Set<String> providersOf(String capability) {
        return capabilityIndex.providersOf(capability);
    }

    /** Every capability provided by at least one catalog service. */
    public Set<String> capabilities() {
        return capabilityIndex.capabilities();
    }

    /**
     * Orders service names by registration; names unknown to the catalog sort last, by name.
     */
    public Comparator<String> registrationOrder() {
        return Comparator
                .comparingInt((String name) -> registrationIndex.getOrDefault(name, Integer.MAX_VALUE))
                .thenComparing(Comparator.naturalOrder());
    }
}
