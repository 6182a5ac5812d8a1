package com.phillippitts.duplexvoice.service.duplex;

import com.phillippitts.duplexvoice.domain.DuplexState;
import com.phillippitts.duplexvoice.domain.TurnState;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for the duplex state and the conversational turn.
 *
 * <p>{@link DuplexState} and {@link TurnState} are the only values both read and written by more
 * than one loop: the listen loop reports user speech while the speak loop begins, interrupts and
 * finishes responses. Every read and write goes through one {@link ReentrantLock}, so an
 * interruption and a fresh utterance landing in the same instant are serialized.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → LISTENING               (start)
 * LISTENING → LISTENING          (onUserSpeech, no response in progress)
 * LISTENING → SPEAKING           (beginResponse)
 * SPEAKING/DUPLEX → DUPLEX       (onUserSpeech while a response is in progress)
 * DUPLEX → LISTENING             (interrupt)
 * SPEAKING/DUPLEX → LISTENING    (endResponse: completion or synthesis failure)
 * any → IDLE                     (reset)
 * </pre>
 *
 * <p>Invariant: DUPLEX holds only while a response is in progress and at least one user
 * transcription arrived after it began.
 */
public final class DuplexStateMachine {

    private final Lock lock = new ReentrantLock();
    private DuplexState state = DuplexState.IDLE;
    private TurnState turn = TurnState.USER;
    private boolean responseInProgress;

    /**
     * Starts a session.
     *
     * @return {@code true} if the machine moved IDLE → LISTENING,
     *         {@code false} if a session is already active
     */
    public boolean start() {
        lock.lock();
        try {
            if (state != DuplexState.IDLE) {
                return false;
            }
            state = DuplexState.LISTENING;
            turn = TurnState.USER;
            responseInProgress = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that a transcription arrived from the listen loop.
     *
     * @return the resulting state; {@code IDLE} if no session is active (the call is ignored)
     */
    public DuplexState onUserSpeech() {
        lock.lock();
        try {
            if (state == DuplexState.IDLE) {
                return state;
            }
            if (responseInProgress) {
                state = DuplexState.DUPLEX;
                turn = TurnState.OVERLAP;
            } else {
                state = DuplexState.LISTENING;
                turn = TurnState.USER;
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attempts to hand the turn to the assistant.
     *
     * @return {@code true} if the machine moved LISTENING → SPEAKING,
     *         {@code false} if the session is idle or a response is already playing
     */
    public boolean beginResponse() {
        lock.lock();
        try {
            if (state != DuplexState.LISTENING) {
                return false;
            }
            state = DuplexState.SPEAKING;
            turn = TurnState.ASSISTANT;
            responseInProgress = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Yields the turn back to the user after an interruption.
     *
     * @return {@code true} if the machine moved DUPLEX → LISTENING,
     *         {@code false} if the state was not DUPLEX
     */
    public boolean interrupt() {
        lock.lock();
        try {
            if (state != DuplexState.DUPLEX) {
                return false;
            }
            toListening();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the current response, whether it completed or synthesis failed.
     *
     * @return {@code true} if a response was in progress and the machine moved to LISTENING,
     *         {@code false} if there was nothing to end (already interrupted or reset)
     */
    public boolean endResponse() {
        lock.lock();
        try {
            if (!responseInProgress || state == DuplexState.IDLE) {
                return false;
            }
            toListening();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the machine back to IDLE. Used by {@code stop()}.
     */
    public void reset() {
        lock.lock();
        try {
            state = DuplexState.IDLE;
            turn = TurnState.USER;
            responseInProgress = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the lock, only if the turn currently equals {@code expected}.
     *
     * <p>The action must not block; it executes with every other transition held off.
     *
     * @return {@code true} if the action ran
     */
    public boolean runIfTurn(TurnState expected, Runnable action) {
        lock.lock();
        try {
            if (state == DuplexState.IDLE || turn != expected) {
                return false;
            }
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public DuplexState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public TurnState getTurn() {
        lock.lock();
        try {
            return turn;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns {@code true} while a response is playing (SPEAKING or DUPLEX).
     */
    public boolean isResponseInProgress() {
        lock.lock();
        try {
            return responseInProgress;
        } finally {
            lock.unlock();
        }
    }

    // Callers must hold the lock
    private void toListening() {
        state = DuplexState.LISTENING;
        turn = TurnState.USER;
        responseInProgress = false;
    }
}
