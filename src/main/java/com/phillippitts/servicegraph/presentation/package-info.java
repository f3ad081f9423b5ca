/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application. Presentation depends on
 * the service layer but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for resolution and catalog queries</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: resolution logic lives in
 * {@link com.phillippitts.servicegraph.service.ResolutionService}, and domain exceptions are
 * translated to status codes in one place.
 *
 * @see com.phillippitts.servicegraph.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.servicegraph.presentation;
