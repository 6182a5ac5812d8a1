package com.phillippitts.duplexvoice.service.stt;

import com.phillippitts.duplexvoice.domain.Transcription;
import com.phillippitts.duplexvoice.exception.RecognitionException;

import java.time.Duration;
import java.util.Optional;

/**
 * Stream of transcriptions produced from one audio source.
 *
 * <p>Pulled by a single listen loop. {@link #close()} may be called from another thread and must
 * cancel recognition mid-stream without hanging a concurrent {@link #poll(Duration)}.
 */
public interface RecognitionStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next transcription.
     *
     * @param timeout maximum wait
     * @return the next transcription, or empty if none arrived in time or the stream is exhausted
     * @throws RecognitionException if one chunk failed to transcribe; the stream stays usable
     * @throws InterruptedException if the calling thread is interrupted
     */
    Optional<Transcription> poll(Duration timeout) throws InterruptedException;

    /**
     * Returns {@code false} once the underlying audio source is exhausted or the stream is closed.
     */
    boolean isOpen();

    /** Cancels recognition. Idempotent. */
    @Override
    void close();
}
