package com.phillippitts.duplexvoice.exception;

/**
 * Thrown when speech synthesis fails, either before the first chunk or mid-utterance.
 * The speak loop treats a mid-utterance failure like an interruption and returns to listening.
 */
public class SynthesisException extends DuplexVoiceException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
