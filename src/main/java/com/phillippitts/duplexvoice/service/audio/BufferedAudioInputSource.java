package com.phillippitts.duplexvoice.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue-backed {@link AudioInputSource} fed by an external capture layer via {@link #push(byte[])}.
 *
 * <p>Bounded: when the reader falls behind by more than {@code capacityChunks}, the oldest chunk
 * is dropped so that recognition stays close to real time. Thread-safe for one producer and one
 * consumer.
 */
public final class BufferedAudioInputSource implements AudioInputSource {

    private static final Logger LOG = LogManager.getLogger(BufferedAudioInputSource.class);

    private static final byte[] END_OF_STREAM = new byte[0];

    private final BlockingQueue<byte[]> chunks;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean exhausted;

    public BufferedAudioInputSource(int capacityChunks) {
        if (capacityChunks <= 0) {
            throw new IllegalArgumentException("capacityChunks must be positive, got: " + capacityChunks);
        }
        // one extra slot so the end marker always fits
        this.chunks = new LinkedBlockingQueue<>(capacityChunks + 1);
    }

    /**
     * Appends a captured chunk.
     *
     * @param chunk PCM data (must not be null; empty chunks are ignored)
     * @throws IllegalStateException if the source has been closed
     */
    public void push(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        if (closed.get()) {
            throw new IllegalStateException("Audio source is closed");
        }
        if (chunk.length == 0) {
            return;
        }
        while (!chunks.offer(chunk)) {
            byte[] dropped = chunks.poll();
            if (dropped != null) {
                LOG.debug("Audio buffer full; dropped oldest chunk ({} bytes)", dropped.length);
            }
        }
    }

    @Override
    public byte[] read() throws InterruptedException {
        if (exhausted) {
            return null;
        }
        byte[] chunk = chunks.take();
        if (chunk == END_OF_STREAM) {
            exhausted = true;
            return null;
        }
        return chunk;
    }

    /**
     * Returns whether the source has been closed; pending chunks may still be readable.
     */
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            chunks.clear();
            chunks.offer(END_OF_STREAM);
        }
    }
}
