package com.phillippitts.servicegraph.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed properties tuning the cross-service validator.
 *
 * <p>Example:
 * <pre>
 * servicegraph:
 *   validation:
 *     privileged-ports:
 *       traefik: [80, 443]
 *     production-domain-suffixes: [".com"]
 *     placeholder-domains: ["example.com"]
 *     local-database-hosts: ["localhost"]
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "servicegraph.validation")
public class ValidationProperties {

    /** Ports below 1024 explicitly granted to a named service. */
    private final Map<String, Set<Integer>> privilegedPorts;

    /** Domain suffixes that make a dev-mode service look like production. */
    private final List<String> productionDomainSuffixes;

    /** Domains that indicate an unchanged template value. */
    private final List<String> placeholderDomains;

    /** Database hosts considered local, so an unencrypted link to them is acceptable. */
    private final List<String> localDatabaseHosts;

    @ConstructorBinding
    public ValidationProperties(Map<String, Set<Integer>> privilegedPorts,
                                List<String> productionDomainSuffixes,
                                List<String> placeholderDomains,
                                List<String> localDatabaseHosts) {
        this.privilegedPorts = privilegedPorts == null ? Map.of() : Map.copyOf(privilegedPorts);
        this.productionDomainSuffixes = productionDomainSuffixes == null
                ? List.of(".com")
                : List.copyOf(productionDomainSuffixes);
        this.placeholderDomains = placeholderDomains == null
                ? List.of("example.com")
                : List.copyOf(placeholderDomains);
        this.localDatabaseHosts = localDatabaseHosts == null
                ? List.of("localhost")
                : List.copyOf(localDatabaseHosts);
    }

    /**
     * Defaults only: no privileged port grants.
     */
    public static ValidationProperties defaults() {
        return new ValidationProperties(null, null, null, null);
    }

    public Map<String, Set<Integer>> getPrivilegedPorts() {
        return privilegedPorts;
    }

    public List<String> getProductionDomainSuffixes() {
        return productionDomainSuffixes;
    }

    public List<String> getPlaceholderDomains() {
        return placeholderDomains;
    }

    public List<String> getLocalDatabaseHosts() {
        return localDatabaseHosts;
    }

    public boolean isPrivilegedPortGranted(String service, int port) {
        return privilegedPorts.getOrDefault(service, Set.of()).contains(port);
    }
}
