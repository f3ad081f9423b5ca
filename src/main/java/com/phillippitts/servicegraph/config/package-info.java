/**
 * Application configuration beans and the startup activation gate.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code servicegraph.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @see com.phillippitts.servicegraph.config.ServiceGraphConfig
 * @since 1.0
 */
package com.phillippitts.servicegraph.config;
