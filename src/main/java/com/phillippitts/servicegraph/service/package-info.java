/**
 * Service layer: the resolution engine and its application-facing entry point.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.catalog} - service descriptors and the capability index</li>
 *   <li>{@code service.resolve} - capability matching, dependency checks, dependency closure</li>
 *   <li>{@code service.graph} - dependency graph, cycle detection, topological sort</li>
 *   <li>{@code service.validation} - cross-service field validation</li>
 *   <li>{@code service.diagnostics} - report aggregation and rendering</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer and Actuator integration</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>The algorithmic classes are plain Java and receive the catalog explicitly</li>
 *   <li>Every resolution builds a fresh graph; nothing is cached between calls</li>
 *   <li>Configuration problems are reported as issues, not thrown</li>
 * </ul>
 *
 * @see com.phillippitts.servicegraph.service.ResolutionEngine
 * @since 1.0
 */
package com.phillippitts.servicegraph.service;
