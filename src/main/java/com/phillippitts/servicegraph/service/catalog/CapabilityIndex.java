package com.phillippitts.servicegraph.service.catalog;

import com.phillippitts.servicegraph.domain.ServiceDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Capability to provider lookup, built once per catalog. Providers are listed in catalog
 * registration order.
 */
final class CapabilityIndex {

    private final Map<String, Set<String>> providersByCapability;

    CapabilityIndex(Collection<ServiceDescriptor> descriptors) {
        Map<String, Set<String>> index = new LinkedHashMap<>();
        for (ServiceDescriptor descriptor : descriptors) {
            for (String capability : descriptor.provides()) {
                index.computeIfAbsent(capability, k -> new LinkedHashSet<>()).add(descriptor.name());
            }
        }
        index.replaceAll((capability, providers) -> Collections.unmodifiableSet(providers));
        this.providersByCapability = Collections.unmodifiableMap(index);
    }

    Set<String> providersOf(String capability) {
        return providersByCapability.getOrDefault(capability, Set.of());
    }

    Set<String> capabilities() {
        return providersByCapability.keySet();
    }
}
