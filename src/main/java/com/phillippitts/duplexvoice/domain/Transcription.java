package com.phillippitts.duplexvoice.domain;

import java.util.Objects;

/**
 * A transcription hypothesis produced by a streaming speech recognizer.
 *
 * <p>Empty text is valid (silence may produce an empty hypothesis).
 *
 * @param text       recognized text (must not be null)
 * @param isFinal    {@code true} when the recognizer marks the hypothesis stable
 * @param confidence confidence score between 0.0 and 1.0
 * @param language   language code reported by the recognizer
 */
public record Transcription(
        String text,
        boolean isFinal,
        double confidence,
        String language
) {

    public Transcription {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(language, "Language must not be null");
    }

    public static Transcription partial(String text, String language) {
        return new Transcription(text, false, 0.5, language);
    }

    public static Transcription finalResult(String text, double confidence, String language) {
        return new Transcription(text, true, confidence, language);
    }
}
