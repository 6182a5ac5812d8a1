package com.phillippitts.duplexvoice.service.response;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Localized phrase tables for acknowledgments, fixed replies and backchannels.
 *
 * <p>Supported languages: {@code en}, {@code vi}. Any other language (including {@code auto})
 * resolves to {@code en}.
 */
public final class ResponseTemplates {

    public static final String FALLBACK_LANGUAGE = "en";

    /** Phrase categories. */
    public enum Category {
        ACKNOWLEDGE,
        SCREENSHOT,
        CONFIRM,
        CANCEL,
        QUESTION,
        GENERIC,
        BACKCHANNEL
    }

    private static final Map<String, Map<Category, List<String>>> TEMPLATES = Map.of(
            "en", Map.of(
                    Category.ACKNOWLEDGE, List.of(
                            "I'll {action} {target} now...",
                            "Working on {action}ing {target}...",
                            "Let me {action} {target} for you...",
                            "On it! {action}ing {target}..."),
                    Category.SCREENSHOT, List.of("Taking a screenshot..."),
                    Category.CONFIRM, List.of("Got it!"),
                    Category.CANCEL, List.of("Cancelled."),
                    Category.QUESTION, List.of("Let me think about that..."),
                    Category.GENERIC, List.of("I understand. How can I help?"),
                    Category.BACKCHANNEL, List.of("uh-huh", "okay", "got it", "I see", "right")),
            "vi", Map.of(
                    Category.ACKNOWLEDGE, List.of(
                            "Tôi sẽ {action} {target} ngay...",
                            "Đang {action} {target}...",
                            "Để tôi {action} {target} cho bạn...",
                            "Được rồi! Đang {action} {target}..."),
                    Category.SCREENSHOT, List.of("Đang chụp màn hình..."),
                    Category.CONFIRM, List.of("Được rồi!"),
                    Category.CANCEL, List.of("Đã hủy."),
                    Category.QUESTION, List.of("Để tôi suy nghĩ..."),
                    Category.GENERIC, List.of("Tôi hiểu. Tôi có thể giúp gì?"),
                    Category.BACKCHANNEL, List.of("ừ", "được", "hiểu rồi", "à", "vâng"))
    );

    private ResponseTemplates() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the phrases of a category for a language.
     *
     * @param category phrase category
     * @param language locale code, may be null
     * @return non-empty, unmodifiable list
     */
    public static List<String> get(Category category, String language) {
        return TEMPLATES.get(resolveLanguage(language)).get(category);
    }

    /**
     * Maps a locale code to a supported language, e.g. {@code "vi-VN"} to {@code "vi"}.
     */
    public static String resolveLanguage(String language) {
        if (language == null || language.isBlank()) {
            return FALLBACK_LANGUAGE;
        }
        String primary = language.trim().toLowerCase(Locale.ROOT).split("[-_]", 2)[0];
        return TEMPLATES.containsKey(primary) ? primary : FALLBACK_LANGUAGE;
    }

    /**
     * Fills {@code {action}} and {@code {target}} placeholders.
     */
    public static String format(String template, String action, String target) {
        return template.replace("{action}", action).replace("{target}", target);
    }
}
