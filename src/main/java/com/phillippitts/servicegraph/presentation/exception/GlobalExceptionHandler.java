package com.phillippitts.servicegraph.presentation.exception;

import com.phillippitts.servicegraph.exception.InvalidServiceConfigurationException;
import com.phillippitts.servicegraph.exception.UnknownServiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Lookup of a service that is not in the catalog or not enabled (HTTP 404).
     */
    @ExceptionHandler(UnknownServiceException.class)
    ResponseEntity<ApiError> handleUnknownService(UnknownServiceException ex) {
        LOG.warn("Unknown service requested: {}", ex.getServiceName());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unknown service",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed service set (HTTP 400).
     */
    @ExceptionHandler(InvalidServiceConfigurationException.class)
    ResponseEntity<ApiError> handleInvalidConfiguration(InvalidServiceConfigurationException ex) {
        LOG.warn("Invalid service configuration: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid service configuration",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - unreadable body or missing parameter (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request could not be read",
                "Check the request body and parameters",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
