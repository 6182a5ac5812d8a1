/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.duplexvoice.exception.ControllerConfigurationException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.duplexvoice.exception.DuplexVoiceException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ControllerConfigurationException",
 *   "message": "Duplex controller is not in the required state",
 *   "details": "No duplex session is running",
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.duplexvoice.presentation.exception;
