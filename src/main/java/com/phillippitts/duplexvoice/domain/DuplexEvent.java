package com.phillippitts.duplexvoice.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event emitted by one of the controller loops and fanned out to every subscriber.
 *
 * @param type      event kind
 * @param data      event payload (never null, unmodifiable)
 * @param timestamp when the event was produced; for interruptions, the trigger time
 */
public record DuplexEvent(
        DuplexEventType type,
        Map<String, Object> data,
        Instant timestamp
) {

    public DuplexEvent {
        Objects.requireNonNull(type, "Event type must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    /**
     * Event for a transcription received by the listen loop.
     */
    public static DuplexEvent transcription(Transcription transcription, Instant at) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", transcription.text());
        data.put("isFinal", transcription.isFinal());
        data.put("confidence", transcription.confidence());
        data.put("language", transcription.language());
        return new DuplexEvent(DuplexEventType.TRANSCRIPTION, data, at);
    }

    /**
     * Event for a response that finished playing without interruption.
     */
    public static DuplexEvent response(String text, Instant at) {
        return new DuplexEvent(DuplexEventType.RESPONSE, Map.of("text", text), at);
    }

    /**
     * Event for an interruption of the response {@code interruptedText}.
     *
     * @param interruptedText  the response that was cut off
     * @param triggeredAt      when the interruption condition fired
     * @param userSpeechAt     timestamp of the user speech that caused it
     */
    public static DuplexEvent interruption(String interruptedText, Instant triggeredAt, Instant userSpeechAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("interruptedText", interruptedText);
        data.put("userSpeechAt", userSpeechAt.toString());
        return new DuplexEvent(DuplexEventType.INTERRUPTION, data, triggeredAt);
    }

    /**
     * Event for a backchannel phrase emitted while the user holds the turn.
     */
    public static DuplexEvent backchannel(String phrase, Instant at) {
        return new DuplexEvent(DuplexEventType.BACKCHANNEL, Map.of("text", phrase), at);
    }
}
