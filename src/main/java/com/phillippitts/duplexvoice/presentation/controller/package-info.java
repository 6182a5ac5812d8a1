/**
 * REST API controllers.
 *
 * <ul>
 *   <li>{@link com.phillippitts.duplexvoice.presentation.controller.PingController}
 *       - {@code GET /ping} liveness and MDC verification</li>
 *   <li>{@link com.phillippitts.duplexvoice.presentation.controller.DuplexStatusController}
 *       - {@code /duplex/status}, {@code /duplex/events} (SSE), {@code /duplex/stop}</li>
 * </ul>
 */
package com.phillippitts.duplexvoice.presentation.controller;
