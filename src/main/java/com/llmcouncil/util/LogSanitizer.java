package com.llmcouncil.util;

/** Utility for privacy-safe logging of prompt and response previews. */
public final class LogSanitizer {

    /** Default preview length for user prompts and model output in log lines. */
    public static final int DEFAULT_PREVIEW_CHARS = 80;

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
     * Single-line preview suitable for a log line: newlines collapsed, cut at
     * {@link #DEFAULT_PREVIEW_CHARS} with a trailing ellipsis when shortened.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= DEFAULT_PREVIEW_CHARS
                ? flat
                : flat.substring(0, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
