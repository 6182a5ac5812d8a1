package com.phillippitts.duplexvoice.domain;

import java.util.Locale;

/**
 * Kinds of {@link DuplexEvent} published on the controller's event stream.
 */
public enum DuplexEventType {
    TRANSCRIPTION,
    RESPONSE,
    INTERRUPTION,
    BACKCHANNEL;

    /**
     * Lower-case wire name used for SSE event names and log output.
     *
     * @return e.g. {@code "interruption"}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
