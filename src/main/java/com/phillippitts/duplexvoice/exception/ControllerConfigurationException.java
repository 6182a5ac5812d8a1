package com.phillippitts.duplexvoice.exception;

/**
 * Thrown synchronously when the controller is configured or driven through its lifecycle
 * incorrectly: invalid {@code DuplexConfig} values, {@code start()} before components are
 * attached, {@code start()} while a session is running, or swapping components mid-session.
 */
public class ControllerConfigurationException extends DuplexVoiceException {

    public ControllerConfigurationException(String message) {
        super(message);
    }
}
