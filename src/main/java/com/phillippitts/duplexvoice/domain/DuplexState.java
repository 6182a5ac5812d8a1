package com.phillippitts.duplexvoice.domain;

/**
 * Audio-flow state of a duplex session. Exactly one value holds at any instant.
 *
 * <pre>
 * IDLE      → LISTENING (start)
 * LISTENING → SPEAKING  (speak loop begins a response)
 * SPEAKING  → DUPLEX    (user speech arrives while a response is playing)
 * DUPLEX    → LISTENING (interruption, completion or synthesis failure)
 * SPEAKING  → LISTENING (completion or synthesis failure)
 * any       → IDLE      (stop)
 * </pre>
 */
public enum DuplexState {
    /** Before {@code start()} and after {@code stop()}. */
    IDLE,
    /** Receiving user audio, no response playing. */
    LISTENING,
    /** Playing a response, no user speech since it began. */
    SPEAKING,
    /** Playing a response while user speech is arriving. */
    DUPLEX
}
