package com.phillippitts.duplexvoice.service.audio;

/**
 * Lazy, effectively infinite source of raw PCM audio chunks.
 *
 * Contract:
 * - Not restartable: a new session requires a new source
 * - {@link #read()} blocks until the next chunk is available
 * - {@link #close()} unblocks pending readers
 */
public interface AudioInputSource extends AutoCloseable {

    /**
     * Returns the next audio chunk, blocking until one is available.
     *
     * @return PCM chunk, or {@code null} once the source is exhausted or closed
     * @throws InterruptedException if the reading thread is interrupted
     */
    byte[] read() throws InterruptedException;

    /** Releases the source. Idempotent. */
    @Override
    void close();
}
