/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend a common unchecked base so the REST boundary can map them in one
 * place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.servicegraph.exception.ServiceGraphException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.servicegraph.exception.UnknownServiceException} - Thrown when a
 *       service name is not in the catalog or not enabled</li>
 *   <li>{@link com.phillippitts.servicegraph.exception.InvalidServiceConfigurationException} -
 *       Thrown when resolution input is malformed (e.g., duplicate service names)</li>
 *   <li>{@link com.phillippitts.servicegraph.exception.CyclicDependencyException} - Thrown when
 *       a startup order is requested for a cyclic graph</li>
 *   <li>{@link com.phillippitts.servicegraph.exception.ConfigurationRejectedException} - Thrown
 *       at startup when the configured services have fatal issues</li>
 * </ul>
 *
 * <p>Configuration problems that the engine diagnoses (port collisions, missing capabilities,
 * and so on) are not exceptions: they are reported as
 * {@link com.phillippitts.servicegraph.domain.ValidationIssue}s so they can all be surfaced
 * together.
 *
 * @see com.phillippitts.servicegraph.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.servicegraph.exception;
