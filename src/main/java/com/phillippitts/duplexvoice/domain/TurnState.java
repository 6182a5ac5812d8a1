package com.phillippitts.duplexvoice.domain;

/**
 * Who currently holds the conversational floor.
 */
public enum TurnState {
    USER,
    ASSISTANT,
    /** Both parties are talking; resolved by an interruption or by the response completing. */
    OVERLAP
}
