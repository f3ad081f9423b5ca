/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.servicegraph.config.logging.MdcFilter} - puts a
 *       {@code requestId} into MDC for every HTTP request and echoes it in
 *       {@code X-Request-ID}</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 09:14:05.112 [http-nio-8080-exec-1] [requestId] INFO  logger.name - message
 * </pre>
 *
 * @see com.phillippitts.servicegraph.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.servicegraph.config.logging;
