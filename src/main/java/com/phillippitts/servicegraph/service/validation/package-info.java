/**
 * Cross-service field validation.
 *
 * <p>{@link com.phillippitts.servicegraph.service.validation.CrossServiceValidator} checks port
 * range and uniqueness, data directory uniqueness and form, domain format, database credentials
 * and TLS settings, and emits advisory warnings. Tunables are bound from
 * {@code servicegraph.validation.*}:
 * <pre>
 * servicegraph.validation.privileged-ports.traefik=80,443
 * servicegraph.validation.production-domain-suffixes=.com
 * servicegraph.validation.placeholder-domains=example.com
 * servicegraph.validation.local-database-hosts=localhost
 * </pre>
 *
 * @see com.phillippitts.servicegraph.config.properties.ValidationProperties
 * @since 1.0
 */
package com.phillippitts.servicegraph.service.validation;
