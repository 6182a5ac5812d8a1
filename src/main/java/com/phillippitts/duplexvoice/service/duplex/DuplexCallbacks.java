package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexEvent;
import com.phillippitts.duplexvoice.domain.Intent;
import com.phillippitts.duplexvoice.domain.Transcription;

import java.util.function.Consumer;

/**
 * Synchronous hooks invoked from the loop that owns each step. Any of them may be null.
 *
 * <p>Callbacks must not block. Exceptions they throw are logged and do not affect the loop.
 * A callback must not call {@link DuplexController#stop()}: stop waits for the calling loop to
 * exit, so the call is rejected with a
 * {@link com.phillippitts.duplexvoice.exception.ControllerConfigurationException}. Hand the stop
 * to another thread instead.
 *
 * @param onTranscription every transcription, partial or final (listen loop)
 * @param onResponse      text of a response that finished playing (speak loop)
 * @param onIntent        intent extracted from a final transcription (process loop)
 * @param onInterruption  interruption event (speak loop)
 */
public record DuplexCallbacks(
        Consumer<Transcription> onTranscription,
        Consumer<String> onResponse,
        Consumer<Intent> onIntent,
        Consumer<DuplexEvent> onInterruption
) {

    /** No callbacks registered. */
    public static final DuplexCallbacks NONE = new DuplexCallbacks(null, null, null, null);
}
