package com.phillippitts.servicegraph.domain;

/**
 * Every kind of problem the engine can report. The severity of an issue is a property of its
 * code, so a given rule is always either blocking or advisory.
 */
public enum IssueCode {

    // dependency graph
    MISSING_REQUIRED_CAPABILITY(Severity.FATAL),
    CONFLICTING_SERVICES(Severity.FATAL),
    CYCLIC_DEPENDENCY(Severity.FATAL),
    UNKNOWN_SERVICE(Severity.FATAL),
    MISSING_OPTIONAL_CAPABILITY(Severity.WARNING),

    // cross-service fields
    PORT_OUT_OF_RANGE(Severity.FATAL),
    PORT_COLLISION(Severity.FATAL),
    DATA_DIR_COLLISION(Severity.FATAL),
    RELATIVE_DATA_DIR(Severity.FATAL),
    INVALID_DOMAIN_FORMAT(Severity.FATAL),
    MISSING_DATABASE_CREDENTIAL(Severity.FATAL),
    INCONSISTENT_SSL_CONFIG(Severity.FATAL),
    DEV_MODE_WITH_PROD_LIKE_DOMAIN(Severity.WARNING),
    DEFAULT_DOMAIN_UNCHANGED(Severity.WARNING),
    UNENCRYPTED_DATABASE_LINK(Severity.WARNING),
    SSL_DISABLED_IN_PROD(Severity.WARNING);

    private final Severity severity;

    IssueCode(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
