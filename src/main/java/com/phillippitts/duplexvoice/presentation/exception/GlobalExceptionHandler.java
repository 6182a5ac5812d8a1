package com.phillippitts.duplexvoice.presentation.exception;

import com.phillippitts.duplexvoice.exception.ControllerConfigurationException;
import com.phillippitts.duplexvoice.exception.DuplexVoiceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Lifecycle misuse, e.g. stopping an idle controller (HTTP 409).
     */
    @ExceptionHandler(ControllerConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ControllerConfigurationException ex) {
        LOG.warn("Controller lifecycle conflict: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Duplex controller is not in the required state",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(DuplexVoiceException.class)
    ResponseEntity<ApiError> handleDuplexFailure(DuplexVoiceException ex) {
        LOG.error("Duplex voice service failure", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Duplex voice service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
