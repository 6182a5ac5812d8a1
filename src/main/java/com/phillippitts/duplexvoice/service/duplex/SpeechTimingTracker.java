package com.phillippitts.duplexvoice.service.duplex;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe holder for the three turn-timing timestamps shared between loops.
 *
 * <p>Each timestamp has exactly one writer (user speech: listen loop, assistant speech: speak
 * loop, backchannel: monitor loop) and any number of readers, so per-field {@link AtomicLong}s
 * are sufficient. Values are epoch milliseconds from the injected {@link Clock}; {@code 0} means
 * "never".
 */
public final class SpeechTimingTracker {

    /** Returned by the {@code millisSince*} methods when the event never happened. */
    public static final long NEVER = Long.MAX_VALUE;

    private final Clock clock;
    private final AtomicLong lastUserSpeechMs = new AtomicLong(0);
    private final AtomicLong lastAssistantSpeechMs = new AtomicLong(0);
    private final AtomicLong lastBackchannelMs = new AtomicLong(0);

    public SpeechTimingTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Current time in epoch milliseconds.
     */
    public long now() {
        return clock.millis();
    }

    /**
     * Records user speech at the current time.
     *
     * @return the recorded timestamp
     */
    public long recordUserSpeech() {
        long now = now();
        lastUserSpeechMs.set(now);
        return now;
    }

    /**
     * Records that an assistant audio chunk was written at the current time.
     */
    public void recordAssistantSpeech() {
        lastAssistantSpeechMs.set(now());
    }

    /**
     * Records a backchannel at the current time.
     *
     * @return the recorded timestamp
     */
    public long recordBackchannel() {
        long now = now();
        lastBackchannelMs.set(now);
        return now;
    }

    public long millisSinceUserSpeech() {
        return since(lastUserSpeechMs.get());
    }

    public long millisSinceAssistantSpeech() {
        return since(lastAssistantSpeechMs.get());
    }

    public long millisSinceBackchannel() {
        return since(lastBackchannelMs.get());
    }

    public long getLastUserSpeechMs() {
        return lastUserSpeechMs.get();
    }

    /**
     * Clears all timestamps. Called when a session starts and stops.
     */
    public void reset() {
        lastUserSpeechMs.set(0);
        lastAssistantSpeechMs.set(0);
        lastBackchannelMs.set(0);
    }

    private long since(long timestamp) {
        if (timestamp == 0) {
            return NEVER;
        }
        return Math.max(0, now() - timestamp);
    }
}
