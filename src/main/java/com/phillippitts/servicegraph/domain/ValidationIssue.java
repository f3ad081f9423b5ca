package com.phillippitts.servicegraph.domain;

import java.util.Objects;

/**
 * A single finding reported against a service.
 *
 * @param severity fatal or warning, always equal to {@code code.severity()}
 * @param code     rule that was violated
 * @param service  service the issue is attributed to
 * @param message  human-readable description naming every service involved
 */
public record ValidationIssue(Severity severity, IssueCode code, String service, String message) {

    public ValidationIssue {
        Objects.requireNonNull(code, "Issue code must not be null");
        Objects.requireNonNull(service, "Service must not be null");
        Objects.requireNonNull(message, "Message must not be null");
        if (severity != code.severity()) {
            throw new IllegalArgumentException(
                    "Severity " + severity + " does not match " + code + " (" + code.severity() + ")");
        }
    }

    public static ValidationIssue of(IssueCode code, String service, String message) {
        return new ValidationIssue(code.severity(), code, service, message);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
