package com.phillippitts.duplexvoice.domain;

import java.util.Locale;

/**
 * Actions an {@link Intent} can carry.
 */
public enum ActionType {
    CLICK,
    TYPE,
    SCROLL,
    DRAG,
    OPEN,
    CLOSE,
    SWITCH,
    NAVIGATE,
    SEARCH,
    GO_BACK,
    GO_FORWARD,
    SAVE,
    COPY,
    PASTE,
    DELETE,
    SCREENSHOT,
    WAIT,
    QUESTION,
    CLARIFY,
    CONFIRM,
    CANCEL,
    UNKNOWN;

    /**
     * Lower-case value used in response templates, e.g. {@code "go_back"}.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves an analyzer-provided action name, falling back to {@link #UNKNOWN}.
     *
     * @param value action name in any case, may be null
     * @return matching action or {@code UNKNOWN}
     */
    public static ActionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
