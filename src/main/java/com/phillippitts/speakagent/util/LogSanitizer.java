package com.phillippitts.speakagent.util;

/** Utility for privacy-safe logging of user text. */
public final class LogSanitizer {

    /** Default preview length for utterances and replies in INFO logs. */
    public static final int DEFAULT_PREVIEW = 40;

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
     * One-line preview: whitespace runs collapse to a single space and text longer than
     * {@code max} is cut with a trailing ellipsis. Includes the original length so
     * truncated values are recognisable in logs.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "\"\"";
        }
        String flat = s.strip().replaceAll("\\s+", " ");
        if (flat.length() <= max) {
            return '"' + flat + '"';
        }
        return '"' + truncate(flat, max) + "…\" (" + flat.length() + " chars)";
    }
}
