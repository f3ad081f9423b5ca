package com.phillippitts.servicegraph.config.properties;

import com.phillippitts.servicegraph.domain.DatabaseConfig;
import com.phillippitts.servicegraph.domain.DatabaseKind;
import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.domain.ServiceInstance;
import com.phillippitts.servicegraph.domain.ServiceMode;
import com.phillippitts.servicegraph.domain.SslConfig;
import com.phillippitts.servicegraph.exception.InvalidServiceConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed properties describing the service set to resolve.
 *
 * <p>Example:
 * <pre>
 * servicegraph:
 *   services:
 *     postgres:
 *       port: 5432
 *       data-dir: /var/lib/postgresql
 *     gitea:
 *       port: 3000
 *       domain: git.internal.lan
 *       database:
 *         type: postgres
 *         password-file: /run/secrets/gitea-db
 *   catalog:
 *     my-app:
 *       provides: [web_service]
 *       requires: [database.postgres]
 *   activation:
 *     fail-on-fatal: true
 * </pre>
 *
 * <p>Entries under {@code catalog} add to or replace descriptors of the built-in catalog.
 * Map keys are service names; YAML order is preserved.
 */
@Validated
@ConfigurationProperties(prefix = "servicegraph")
public class ServiceGraphProperties {

    static final String DEFAULT_DATA_DIR_ROOT = "/var/lib/";

    /** Configured services keyed by name. */
    @Valid
    private final Map<String, ServiceProperties> services;

    /** Catalog additions and overrides keyed by service name. */
    @Valid
    private final Map<String, CatalogEntryProperties> catalog;

    /** Startup activation gate settings. */
    @Valid
    @NotNull
    private final Activation activation;

    @ConstructorBinding
    public ServiceGraphProperties(Map<String, ServiceProperties> services,
                                  Map<String, CatalogEntryProperties> catalog,
                                  Activation activation) {
        this.services = services == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(services));
        this.catalog = catalog == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(catalog));
        this.activation = activation == null ? new Activation(null, null) : activation;
    }

    public Map<String, ServiceProperties> getServices() {
        return services;
    }

    public Map<String, CatalogEntryProperties> getCatalog() {
        return catalog;
    }

    public Activation getActivation() {
        return activation;
    }

    /**
     * Converts the enabled services into engine instances.
     *
     * @throws InvalidServiceConfigurationException if an enabled service has no port
     */
    public List<ServiceInstance> enabledInstances() {
        List<ServiceInstance> instances = new ArrayList<>();
        services.forEach((name, service) -> {
            if (service.isEnable()) {
                instances.add(service.toInstance(name));
            }
        });
        return instances;
    }

    /**
     * Converts the {@code catalog} entries into descriptors.
     */
    public List<ServiceDescriptor> catalogOverrides() {
        List<ServiceDescriptor> descriptors = new ArrayList<>();
        catalog.forEach((name, entry) -> descriptors.add(entry.toDescriptor(name)));
        return descriptors;
    }

    /**
     * One configured service. {@code enable} defaults to true; {@code data-dir} defaults to
     * {@code /var/lib/<name>}; {@code mode} defaults to prod.
     */
    public static class ServiceProperties {

        private final boolean enable;
        private final Integer port;
        private final String dataDir;
        private final String domain;
        private final ServiceMode mode;

        @Valid
        private final DatabaseProperties database;

        private final SslProperties ssl;

        public ServiceProperties(Boolean enable,
                                 Integer port,
                                 String dataDir,
                                 String domain,
                                 ServiceMode mode,
                                 DatabaseProperties database,
                                 SslProperties ssl) {
            this.enable = enable == null || enable;
            this.port = port;
            this.dataDir = dataDir;
            this.domain = domain;
            this.mode = mode == null ? ServiceMode.PROD : mode;
            this.database = database;
            this.ssl = ssl;
        }

        public boolean isEnable() {
            return enable;
        }

        public Integer getPort() {
            return port;
        }

        public String getDataDir() {
            return dataDir;
        }

        public String getDomain() {
            return domain;
        }

        public ServiceMode getMode() {
            return mode;
        }

        public DatabaseProperties getDatabase() {
            return database;
        }

        public SslProperties getSsl() {
            return ssl;
        }

        ServiceInstance toInstance(String name) {
            if (port == null) {
                throw new InvalidServiceConfigurationException(
                        "servicegraph.services." + name + ".port is required for an enabled service");
            }
            String dir = (dataDir == null || dataDir.isBlank()) ? DEFAULT_DATA_DIR_ROOT + name : dataDir;
            return new ServiceInstance(name, port, dir, domain,
                    database == null ? null : database.toConfig(),
                    ssl == null ? null : ssl.toConfig(),
                    mode);
        }
    }

    /** Database settings of a configured service. */
    public static class DatabaseProperties {

        @NotNull
        private final DatabaseKind type;
        private final String host;
        @Min(1)
        @Max(65535)
        private final Integer port;
        private final String name;
        private final String user;
        private final String passwordFile;

        public DatabaseProperties(DatabaseKind type,
                                  String host,
                                  Integer port,
                                  String name,
                                  String user,
                                  String passwordFile) {
            this.type = type;
            this.host = host;
            this.port = port;
            this.name = name;
            this.user = user;
            this.passwordFile = passwordFile;
        }

        public DatabaseKind getType() {
            return type;
        }

        public String getHost() {
            return host;
        }

        public Integer getPort() {
            return port;
        }

        public String getName() {
            return name;
        }

        public String getUser() {
            return user;
        }

        public String getPasswordFile() {
            return passwordFile;
        }

        DatabaseConfig toConfig() {
            return new DatabaseConfig(type, host, port, name, user, passwordFile);
        }
    }

    /** TLS settings of a configured service. */
    public static class SslProperties {

        private final boolean enable;
        private final String certificate;
        private final String certificateKey;
        private final String acmeHost;

        public SslProperties(Boolean enable, String certificate, String certificateKey, String acmeHost) {
            this.enable = enable == null || enable;
            this.certificate = certificate;
            this.certificateKey = certificateKey;
            this.acmeHost = acmeHost;
        }

        public boolean isEnable() {
            return enable;
        }

        public String getCertificate() {
            return certificate;
        }

        public String getCertificateKey() {
            return certificateKey;
        }

        public String getAcmeHost() {
            return acmeHost;
        }

        SslConfig toConfig() {
            return new SslConfig(enable, certificate, certificateKey, acmeHost);
        }
    }

    /** Capability declarations of a catalog entry. */
    public static class CatalogEntryProperties {

        private final List<String> provides;
        private final List<String> requires;
        private final List<String> after;
        private final List<String> conflicts;
        private final List<String> optional;

        public CatalogEntryProperties(List<String> provides,
                                      List<String> requires,
                                      List<String> after,
                                      List<String> conflicts,
                                      List<String> optional) {
            this.provides = provides == null ? List.of() : List.copyOf(provides);
            this.requires = requires == null ? List.of() : List.copyOf(requires);
            this.after = after == null ? List.of() : List.copyOf(after);
            this.conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
            this.optional = optional == null ? List.of() : List.copyOf(optional);
        }

        public List<String> getProvides() {
            return provides;
        }

        public List<String> getRequires() {
            return requires;
        }

        public List<String> getAfter() {
            return after;
        }

        public List<String> getConflicts() {
            return conflicts;
        }

        public List<String> getOptional() {
            return optional;
        }

        ServiceDescriptor toDescriptor(String name) {
            return ServiceDescriptor.builder(name)
                    .provides(provides.toArray(String[]::new))
                    .requires(requires.toArray(String[]::new))
                    .after(after.toArray(String[]::new))
                    .conflicts(conflicts.toArray(String[]::new))
                    .optional(optional.toArray(String[]::new))
                    .build();
        }
    }

    /**
     * Startup activation gate. When {@code enabled}, the configured services are resolved at
     * startup; when {@code fail-on-fatal} is also set, any fatal issue aborts startup.
     */
    public static class Activation {

        private final boolean enabled;
        private final boolean failOnFatal;

        public Activation(Boolean enabled, Boolean failOnFatal) {
            this.enabled = enabled == null || enabled;
            this.failOnFatal = failOnFatal == null || failOnFatal;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public boolean isFailOnFatal() {
            return failOnFatal;
        }
    }
}
