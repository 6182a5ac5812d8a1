/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by
 *       {@link com.phillippitts.duplexvoice.config.logging.MdcFilter}</li>
 *   <li>{@code sessionId} - per duplex session, set on every controller loop thread</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [duplex-loop-1] [requestId] [sessionId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.duplexvoice.config.logging;
