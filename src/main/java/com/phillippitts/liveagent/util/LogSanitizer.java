package com.phillippitts.liveagent.util;

/** Utility for privacy-safe logging of transcript and model text. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview for log messages: newlines collapsed, long text cut with an ellipsis.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\n', ' ').replace('\r', ' ').strip();
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, Math.max(0, max - ELLIPSIS.length())) + ELLIPSIS;
    }
}
