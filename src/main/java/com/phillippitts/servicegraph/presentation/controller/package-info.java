/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/resolution} - report for the configured services</li>
 *   <li>{@code POST /api/resolution} - report for a posted {@code {"services": [...]}} body</li>
 *   <li>{@code GET /api/units/{service}} - unit directives of an enabled service</li>
 *   <li>{@code GET /api/catalog} - effective catalog in registration order</li>
 *   <li>{@code GET /api/catalog/closure?service=...} - dependency closure suggestion</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.servicegraph.presentation.controller;
