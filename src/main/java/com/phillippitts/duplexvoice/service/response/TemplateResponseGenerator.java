package com.phillippitts.duplexvoice.service.response;

import com.phillippitts.duplexvoice.domain.ActionType;
import com.phillippitts.duplexvoice.domain.Intent;
import com.phillippitts.duplexvoice.service.response.ResponseTemplates.Category;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Local template lookup: acknowledges desktop actions, stalls on questions and falls back to a
 * generic acknowledgment for everything else.
 *
 * <p>Always picks the first template of a category so the mapping is deterministic given the same
 * {@code (action, target, language)}.
 */
public class TemplateResponseGenerator implements ResponseGenerator {

    static final String DEFAULT_TARGET = "that";

    private static final Set<ActionType> ACKNOWLEDGED_ACTIONS = EnumSet.of(
            ActionType.CLICK, ActionType.TYPE, ActionType.SCROLL, ActionType.OPEN,
            ActionType.CLOSE, ActionType.NAVIGATE, ActionType.SEARCH, ActionType.DRAG);

    @Override
    public String generate(Intent intent, String defaultLanguage) {
        Objects.requireNonNull(intent, "intent must not be null");
        String language = intent.language() != null && !intent.language().isBlank()
                ? intent.language()
                : defaultLanguage;

        ActionType action = intent.action();
        if (ACKNOWLEDGED_ACTIONS.contains(action)) {
            String target = intent.target() == null || intent.target().isBlank()
                    ? DEFAULT_TARGET
                    : intent.target();
            String template = first(Category.ACKNOWLEDGE, language);
            return ResponseTemplates.format(template, action.value(), target);
        }
        return switch (action) {
            case SCREENSHOT -> first(Category.SCREENSHOT, language);
            case CONFIRM -> first(Category.CONFIRM, language);
            case CANCEL -> first(Category.CANCEL, language);
            case QUESTION -> first(Category.QUESTION, language);
            default -> first(Category.GENERIC, language);
        };
    }

    private static String first(Category category, String language) {
        return ResponseTemplates.get(category, language).get(0);
    }
}
