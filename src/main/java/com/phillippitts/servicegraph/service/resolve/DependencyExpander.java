package com.phillippitts.servicegraph.service.resolve;

import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.service.catalog.ServiceCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the set of services to enable so that every hard requirement of the requested
 * services is met, following requirements transitively.
 *
 * <p>For each required capability not already provided by the set, the first catalog provider
 * that does not conflict with the set is added. Capabilities no compatible provider can satisfy
 * are left open; resolution of the expanded set reports them.
 */
public final class DependencyExpander {

    private static final Logger LOG = LogManager.getLogger(DependencyExpander.class);

    private final ServiceCatalog catalog;

    public DependencyExpander(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Expands the requested services with the providers they transitively need.
     *
     * @param requested service names (must all be in the catalog)
     * @return requested and added services, in catalog order
     * @throws com.phillippitts.servicegraph.exception.UnknownServiceException if a requested
     *         name is not in the catalog
     */
    public List<String> expand(Collection<String> requested) {
        Set<String> selected = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String name : requested) {
            catalog.descriptor(name);
            if (selected.add(name)) {
                pending.add(name);
            }
        }

        while (!pending.isEmpty()) {
            ServiceDescriptor descriptor = catalog.descriptor(pending.poll());
            for (String capability : descriptor.requires()) {
                if (isProvided(capability, selected)) {
                    continue;
                }
                Optional<String> provider = compatibleProvider(capability, selected);
                if (provider.isPresent()) {
                    LOG.debug("Adding '{}' to provide '{}' for '{}'", provider.get(), capability, descriptor.name());
                    selected.add(provider.get());
                    pending.add(provider.get());
                } else {
                    LOG.debug("No compatible provider for '{}' required by '{}'", capability, descriptor.name());
                }
            }
        }

        return selected.stream().sorted(catalog.registrationOrder()).toList();
    }

    private boolean isProvided(String capability, Set<String> selected) {
        for (String provider : catalog.providersOf(capability)) {
            if (selected.contains(provider)) {
                return true;
            }
        }
        return false;
    }

    private Optional<String> compatibleProvider(String capability, Set<String> selected) {
        for (String candidate : catalog.providersOf(capability)) {
            if (!conflictsWithAny(candidate, selected)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean conflictsWithAny(String candidate, Set<String> selected) {
        if (!Collections.disjoint(catalog.descriptor(candidate).conflicts(), selected)) {
            return true;
        }
        for (String service : selected) {
            if (catalog.descriptor(service).conflicts().contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
