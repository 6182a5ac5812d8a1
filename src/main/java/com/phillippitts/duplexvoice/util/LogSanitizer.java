package com.phillippitts.duplexvoice.util;

/** Utility for privacy-safe logging of transcript and response previews. */
public final class LogSanitizer {

    /** Default preview length for user and assistant text in log lines. */
    public static final int PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Truncates to {@link #PREVIEW_CHARS}.
     */
    public static String preview(String s) {
        return truncate(s, PREVIEW_CHARS);
    }
}
