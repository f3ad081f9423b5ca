package com.phillippitts.servicegraph.domain;

/** Deployment mode of a service instance. */
public enum ServiceMode {
    DEV,
    PROD
}
