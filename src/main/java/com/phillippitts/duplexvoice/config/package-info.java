/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.duplexvoice.config.ThreadPoolConfig} - executors for the duplex
 *       loops, backchannel playback and SSE event pumping</li>
 *   <li>{@link com.phillippitts.duplexvoice.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for those executors</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code duplex.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.orchestration} - controller wiring</li>
 *   <li>{@code config.logging} - MDC request filter</li>
 * </ul>
 */
package com.phillippitts.duplexvoice.config;
