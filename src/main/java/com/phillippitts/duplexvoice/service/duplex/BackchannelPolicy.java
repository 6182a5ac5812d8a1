package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexConfig;
import com.phillippitts.duplexvoice.domain.TurnState;
import com.phillippitts.duplexvoice.service.response.ResponseTemplates;
import com.phillippitts.duplexvoice.service.response.ResponseTemplates.Category;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Throttling rule and phrase rotation for backchannels.
 *
 * <p>A backchannel is due when the user holds the turn, the previous backchannel is older than
 * {@code backchannelInterval}, and the user spoke within {@code userSpeechFreshness}. Phrases
 * rotate round-robin through the configured language's list.
 */
public final class BackchannelPolicy {

    private final boolean enabled;
    private final long intervalMs;
    private final long freshnessMs;
    private final List<String> phrases;
    private final AtomicInteger nextIndex = new AtomicInteger(0);

    public BackchannelPolicy(DuplexConfig config) {
        Objects.requireNonNull(config, "config");
        this.enabled = config.enableBackchannels();
        this.intervalMs = config.backchannelInterval().toMillis();
        this.freshnessMs = config.userSpeechFreshness().toMillis();
        this.phrases = ResponseTemplates.get(Category.BACKCHANNEL, config.language());
    }

    /**
     * @param turn                   current turn holder
     * @param millisSinceBackchannel elapsed time since the last backchannel, or
     *                               {@link SpeechTimingTracker#NEVER}
     * @param millisSinceUserSpeech  elapsed time since the last user speech, or
     *                               {@link SpeechTimingTracker#NEVER}
     * @return {@code true} if a backchannel should be emitted now
     */
    public boolean shouldEmit(TurnState turn, long millisSinceBackchannel, long millisSinceUserSpeech) {
        return enabled
                && turn == TurnState.USER
                && millisSinceBackchannel > intervalMs
                && millisSinceUserSpeech < freshnessMs;
    }

    /**
     * Returns the next phrase in rotation.
     */
    public String nextPhrase() {
        int index = Math.floorMod(nextIndex.getAndIncrement(), phrases.size());
        return phrases.get(index);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
