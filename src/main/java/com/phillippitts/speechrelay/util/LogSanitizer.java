package com.phillippitts.speechrelay.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Returns at most {@code max} characters of {@code text}, followed by the original length
     * when truncated, e.g. {@code "hello wo… (23 chars)"}. Returns "" for null or non-positive max.
     */
    public static String preview(String text, int max) {
        if (text == null || max <= 0) {
            return "";
        }
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "… (" + text.length() + " chars)";
    }
}
