package com.phillippitts.servicegraph.domain;

/**
 * Database backends a service can be configured against.
 */
public enum DatabaseKind {
    SQLITE3(false),
    MYSQL(true),
    POSTGRES(true),
    REDIS(false);

    private final boolean networked;

    DatabaseKind(boolean networked) {
        this.networked = networked;
    }

    /**
     * Whether this backend authenticates over a network connection, and therefore needs a
     * password file and should be reached over an encrypted link when remote.
     */
    public boolean isNetworked() {
        return networked;
    }
}
