package com.phillippitts.duplexvoice.service.stt;

import com.phillippitts.duplexvoice.service.audio.AudioInputSource;

/**
 * Contract for streaming Speech-to-Text engines (external collaborator).
 *
 * <p>Implementations wrap a concrete recognizer behind this interface. Thread Safety: a stream is
 * consumed by one thread, but {@link RecognitionStream#close()} may arrive from another.
 */
public interface SpeechRecognizer {

    /**
     * Starts streaming recognition over the given audio source.
     *
     * @param audio    audio source; owned by the caller
     * @param language locale code, e.g. {@code "en"}
     * @return an open recognition stream
     */
    RecognitionStream transcribeStream(AudioInputSource audio, String language);
}
