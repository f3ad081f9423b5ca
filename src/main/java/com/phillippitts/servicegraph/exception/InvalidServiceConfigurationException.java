package com.phillippitts.servicegraph.exception;

/**
 * Thrown when resolution input is malformed before any rule can be evaluated, for example
 * when the same service name is supplied twice.
 */
public class InvalidServiceConfigurationException extends ServiceGraphException {

    private final String reason;

    public InvalidServiceConfigurationException(String reason) {
        super("Invalid service configuration: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
