package com.phillippitts.duplexvoice.service.audio;

/**
 * Fire-and-forget consumer of synthesized PCM audio chunks (speaker, network stream, file).
 */
@FunctionalInterface
public interface AudioOutputSink {

    /**
     * Writes one chunk. Must not block for longer than the chunk's playback time.
     *
     * @param chunk PCM audio chunk
     */
    void write(byte[] chunk);
}
