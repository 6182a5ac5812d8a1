package com.phillippitts.duplexvoice.exception;

/**
 * Base exception for all duplex-voice application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DuplexVoiceException extends RuntimeException {

    public DuplexVoiceException(String message) {
        super(message);
    }

    public DuplexVoiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public DuplexVoiceException(Throwable cause) {
        super(cause);
    }
}
