/**
 * Domain models for service resolution.
 *
 * <p>All domain models are immutable records that validate their own invariants in the
 * compact constructor.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.servicegraph.domain.ServiceDescriptor} - static capability
 *       declarations of a known service</li>
 *   <li>{@link com.phillippitts.servicegraph.domain.ServiceInstance} - one enabled service with
 *       its port, data directory, domain, database and TLS settings</li>
 *   <li>{@link com.phillippitts.servicegraph.domain.ValidationIssue} - a fatal issue or warning,
 *       classified by {@link com.phillippitts.servicegraph.domain.IssueCode}</li>
 *   <li>{@link com.phillippitts.servicegraph.domain.ResolutionReport} - merged outcome of one
 *       resolution</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.servicegraph.domain;
