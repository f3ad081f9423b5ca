package com.phillippitts.servicegraph.service.catalog;

import com.phillippitts.servicegraph.domain.ServiceDescriptor;

/**
 * Descriptors for the services shipped with the platform. Configuration can add to or replace
 * these entries (see {@code servicegraph.catalog.*}).
 */
public final class BuiltInCatalog {

    public static final String DATABASE_POSTGRES = "database.postgres";
    public static final String DATABASE_REDIS = "database.redis";
    public static final String CACHE = "cache";
    public static final String REVERSE_PROXY = "reverse_proxy";
    public static final String WEB_SERVICE = "web.service";
    public static final String MONITORING_METRICS = "monitoring.metrics";
    public static final String SERVICE_DISCOVERY = "service.discovery";

    private static final ServiceCatalog CATALOG = ServiceCatalog.of(
            // databases
            ServiceDescriptor.builder("postgres")
                    .provides(DATABASE_POSTGRES)
                    .build(),
            ServiceDescriptor.builder("redis")
                    .provides(DATABASE_REDIS, CACHE)
                    .build(),

            // web services backed by a database
            ServiceDescriptor.builder("gitea")
                    .provides("git.server", WEB_SERVICE)
                    .requires(DATABASE_POSTGRES)
                    .after("postgres")
                    .optional(REVERSE_PROXY)
                    .build(),
            ServiceDescriptor.builder("mastodon")
                    .provides("social.server", WEB_SERVICE)
                    .requires(DATABASE_POSTGRES, DATABASE_REDIS)
                    .after("postgres", "redis")
                    .optional(REVERSE_PROXY)
                    .build(),
            ServiceDescriptor.builder("matrix-synapse")
                    .provides("chat.server", WEB_SERVICE)
                    .requires(DATABASE_POSTGRES)
                    .after("postgres")
                    .optional(REVERSE_PROXY)
                    .build(),
            ServiceDescriptor.builder("vaultwarden")
                    .provides("password.manager", WEB_SERVICE)
                    .optional(DATABASE_POSTGRES, REVERSE_PROXY)
                    .build(),

            // reverse proxies, mutually exclusive
            ServiceDescriptor.builder("traefik")
                    .provides(REVERSE_PROXY, "load_balancer")
                    .conflicts("haproxy", "nginx")
                    .build(),
            ServiceDescriptor.builder("haproxy")
                    .provides(REVERSE_PROXY, "load_balancer")
                    .conflicts("traefik", "nginx")
                    .build(),
            ServiceDescriptor.builder("nginx")
                    .provides(REVERSE_PROXY, "web.server")
                    .conflicts("traefik", "haproxy")
                    .build(),

            // monitoring
            ServiceDescriptor.builder("prometheus")
                    .provides(MONITORING_METRICS)
                    .build(),
            ServiceDescriptor.builder("grafana")
                    .provides("monitoring.visualization")
                    .optional(MONITORING_METRICS)
                    .build(),

            // authentication
            ServiceDescriptor.builder("keycloak")
                    .provides("auth.server", "sso")
                    .requires(DATABASE_POSTGRES)
                    .after("postgres")
                    .optional(REVERSE_PROXY)
                    .build(),

            // orchestration
            ServiceDescriptor.builder("consul")
                    .provides(SERVICE_DISCOVERY, "kv.store")
                    .build(),
            ServiceDescriptor.builder("nomad")
                    .provides("container.orchestration")
                    .conflicts("kubernetes")
                    .optional(SERVICE_DISCOVERY)
                    .build(),

            // media and home automation
            ServiceDescriptor.builder("jellyfin")
                    .provides("media.server")
                    .conflicts("plex", "emby")
                    .optional(REVERSE_PROXY)
                    .build(),
            ServiceDescriptor.builder("home-assistant")
                    .provides("home.automation")
                    .optional(DATABASE_POSTGRES, REVERSE_PROXY)
                    .build()
    );

    private BuiltInCatalog() {}

    public static ServiceCatalog catalog() {
        return CATALOG;
    }
}
