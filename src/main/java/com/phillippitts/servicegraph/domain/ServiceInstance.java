package com.phillippitts.servicegraph.domain;

import java.util.Objects;

/**
 * One enabled service as configured for the current resolution. Created from user-supplied
 * configuration and read-only thereafter.
 *
 * <p>{@code domain}, {@code database} and {@code ssl} are optional and may be null when the
 * service does not declare them.
 *
 * @param name     service name, matched against the catalog
 * @param port     main listening port
 * @param dataDir  data directory (expected to be absolute)
 * @param domain   public domain, or null
 * @param database database settings, or null
 * @param ssl      TLS settings, or null
 * @param mode     deployment mode (defaults to {@link ServiceMode#PROD})
 */
public record ServiceInstance(
        String name,
        int port,
        String dataDir,
        String domain,
        DatabaseConfig database,
        SslConfig ssl,
        ServiceMode mode
) {

    public ServiceInstance {
        Objects.requireNonNull(name, "Service name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        Objects.requireNonNull(dataDir, "Data directory must not be null for service '" + name + "'");
        mode = mode == null ? ServiceMode.PROD : mode;
    }

    /**
     * Creates a minimal production instance without domain, database or TLS settings.
     */
    public static ServiceInstance of(String name, int port, String dataDir) {
        return new ServiceInstance(name, port, dataDir, null, null, null, ServiceMode.PROD);
    }

    public boolean hasDomain() {
        return domain != null && !domain.isBlank();
    }

    public ServiceInstance withDomain(String newDomain) {
        return new ServiceInstance(name, port, dataDir, newDomain, database, ssl, mode);
    }

    public ServiceInstance withDatabase(DatabaseConfig newDatabase) {
        return new ServiceInstance(name, port, dataDir, domain, newDatabase, ssl, mode);
    }

    public ServiceInstance withSsl(SslConfig newSsl) {
        return new ServiceInstance(name, port, dataDir, domain, database, newSsl, mode);
    }

    public ServiceInstance withMode(ServiceMode newMode) {
        return new ServiceInstance(name, port, dataDir, domain, database, ssl, newMode);
    }
}
