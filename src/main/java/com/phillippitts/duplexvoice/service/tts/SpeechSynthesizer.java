package com.phillippitts.duplexvoice.service.tts;

import java.util.Iterator;

/**
 * Contract for streaming Text-to-Speech engines (external collaborator).
 */
public interface SpeechSynthesizer {

    /**
     * Synthesizes {@code text} lazily, one audio chunk per {@link Iterator#next()}.
     *
     * <p>The iterator may block while the next chunk is produced. After {@link #stop()} it must
     * report no further chunks within one chunk's duration.
     *
     * @param text     text to speak
     * @param language locale code
     * @return iterator over PCM chunks
     * @throws com.phillippitts.duplexvoice.exception.SynthesisException if synthesis fails; the
     *         returned iterator reports a mid-utterance failure the same way from {@code next()}
     */
    Iterator<byte[]> speakStream(String text, String language);

    /**
     * Stops any synthesis in progress immediately. Safe to call concurrently and repeatedly.
     */
    void stop();
}
