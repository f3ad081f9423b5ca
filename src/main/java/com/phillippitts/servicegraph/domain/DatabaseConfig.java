package com.phillippitts.servicegraph.domain;

import java.util.Objects;

/**
 * Database connection settings of a service instance.
 *
 * @param type         database backend
 * @param host         database host (defaults to "localhost")
 * @param port         database port, or null for the backend's default
 * @param name         database name (defaults to "app")
 * @param user         database user (defaults to "app")
 * @param passwordFile path to the password file, or null when unset
 */
public record DatabaseConfig(
        DatabaseKind type,
        String host,
        Integer port,
        String name,
        String user,
        String passwordFile
) {

    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_NAME = "app";
    public static final String DEFAULT_USER = "app";

    public DatabaseConfig {
        Objects.requireNonNull(type, "Database type must not be null");
        host = (host == null || host.isBlank()) ? DEFAULT_HOST : host;
        name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
        user = (user == null || user.isBlank()) ? DEFAULT_USER : user;
    }

    /**
     * Creates a configuration with default host, name and user.
     */
    public static DatabaseConfig of(DatabaseKind type, String passwordFile) {
        return new DatabaseConfig(type, null, null, null, null, passwordFile);
    }

    public boolean hasPasswordFile() {
        return passwordFile != null && !passwordFile.isBlank();
    }
}
