/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.servicegraph.exception.UnknownServiceException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.servicegraph.exception.InvalidServiceConfigurationException} → 400 Bad Request</li>
 *   <li>Unreadable body or missing request parameter → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "UnknownServiceException",
 *   "message": "Unknown service",
 *   "details": "Unknown service: gitlab (not an enabled catalog service)",
 *   "timestamp": "2026-03-02T09:14:05.112Z"
 * }
 * </pre>
 *
 * <p>A configuration with fatal issues is not an error here: resolution endpoints return the
 * report with status 200. Stack traces never reach clients; details are logged server-side.
 *
 * @see com.phillippitts.servicegraph.exception
 * @since 1.0
 */
package com.phillippitts.servicegraph.presentation.exception;
