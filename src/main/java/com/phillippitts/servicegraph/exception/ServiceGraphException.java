package com.phillippitts.servicegraph.exception;

/**
 * Base exception for all service-graph application errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ServiceGraphException extends RuntimeException {

    public ServiceGraphException(String message) {
        super(message);
    }

    public ServiceGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public ServiceGraphException(Throwable cause) {
        super(cause);
    }
}
