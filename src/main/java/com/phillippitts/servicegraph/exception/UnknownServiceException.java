package com.phillippitts.servicegraph.exception;

/**
 * Thrown when a service name is not present where it is looked up: in the catalog, or among
 * the enabled services of the current configuration.
 */
public class UnknownServiceException extends ServiceGraphException {

    private final String serviceName;

    public UnknownServiceException(String serviceName) {
        super("Unknown service: " + serviceName);
        this.serviceName = serviceName;
    }

    public UnknownServiceException(String serviceName, String detail) {
        super("Unknown service: " + serviceName + " (" + detail + ")");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
