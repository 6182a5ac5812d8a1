package com.phillippitts.duplexvoice.exception;

/**
 * Thrown by a recognition stream when a single audio chunk could not be transcribed.
 * The stream remains usable; the listen loop logs and skips the chunk.
 */
public class RecognitionException extends DuplexVoiceException {

    private final String engineName;

    public RecognitionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public RecognitionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public RecognitionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
