package com.phillippitts.duplexvoice.domain;

import java.util.Objects;

/**
 * Structured intent extracted from a final transcription.
 *
 * @param action   recognized action (never null)
 * @param target   primary target entity, or {@code null} when none was found
 * @param raw      the text the intent was extracted from
 * @param language language of {@code raw}, or {@code null} if the analyzer did not detect one
 */
public record Intent(
        ActionType action,
        String target,
        String raw,
        String language
) {

    public Intent {
        Objects.requireNonNull(action, "Action must not be null");
        Objects.requireNonNull(raw, "Raw text must not be null");
    }

    public static Intent of(ActionType action, String target, String raw) {
        return new Intent(action, target, raw, null);
    }
}
