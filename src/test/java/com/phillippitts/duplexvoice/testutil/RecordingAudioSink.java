package com.phillippitts.duplexvoice.testutil;

import com.phillippitts.duplexvoice.service.audio.AudioOutputSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audio sink that keeps every chunk it receives.
 */
public class RecordingAudioSink implements AudioOutputSink {

    private final List<byte[]> chunks = new CopyOnWriteArrayList<>();

    @Override
    public void write(byte[] chunk) {
        chunks.add(chunk);
    }

    public int chunkCount() {
        return chunks.size();
    }
}
