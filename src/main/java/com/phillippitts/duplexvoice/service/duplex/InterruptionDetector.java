package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.domain.DuplexState;

import java.util.Objects;

/**
 * Decides whether fresh user speech should cut off the response currently playing.
 *
 * <p>The condition fires only in {@link DuplexState#DUPLEX}, only when interruptions are allowed,
 * and only while the last user speech is strictly newer than the interruption threshold.
 * Evaluated by the speak loop before every chunk it writes.
 */
public final class InterruptionDetector {

    private final boolean allowInterruptions;
    private final long thresholdMs;

    public InterruptionDetector(DuplexConfig config) {
        Objects.requireNonNull(config, "config");
        this.allowInterruptions = config.allowInterruptions();
        this.thresholdMs = config.interruptionThreshold().toMillis();
    }

    /**
     * @param state                 current duplex state
     * @param millisSinceUserSpeech elapsed time since the last user speech, or
     *                              {@link SpeechTimingTracker#NEVER}
     * @return {@code true} if the response should be interrupted now
     */
    public boolean shouldInterrupt(DuplexState state, long millisSinceUserSpeech) {
        return allowInterruptions
                && state == DuplexState.DUPLEX
                && millisSinceUserSpeech < thresholdMs;
    }
}
