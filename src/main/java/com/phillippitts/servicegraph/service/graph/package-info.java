/**
 * Dependency graph over enabled services.
 *
 * <p>Hard edges run from a provider to the service that requires one of its capabilities and
 * decide feasibility: {@link com.phillippitts.servicegraph.service.graph.CycleDetector} and
 * {@link com.phillippitts.servicegraph.service.graph.TopologicalSorter} both work on them.
 * Soft edges come from {@code after} declarations and only break ties between ready services.
 *
 * <p>Node order is catalog registration order, which makes every traversal deterministic.
 *
 * @since 1.0
 */
package com.phillippitts.servicegraph.service.graph;
