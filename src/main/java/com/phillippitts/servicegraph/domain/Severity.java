package com.phillippitts.servicegraph.domain;

/**
 * Severity of a {@link ValidationIssue}. Fatal issues block configuration activation; warnings
 * are advisory.
 */
public enum Severity {
    FATAL,
    WARNING
}
