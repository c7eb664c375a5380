package com.phillippitts.platemate.util;

/** Utility for privacy-safe logging of user queries and model replies. */
public final class LogSanitizer {

    /** Default preview length for user text in logs. */
    public static final int DEFAULT_PREVIEW = 40;

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
     * Preview of free text for log lines: truncated to {@link #DEFAULT_PREVIEW} characters,
     * with line breaks flattened so one message stays on one log line.
     */
    public static String preview(String s) {
        return truncate(s, DEFAULT_PREVIEW).replace('\n', ' ').replace('\r', ' ');
    }
}
