package com.phillippitts.scantomack.util;

/** Utility for privacy-safe logging of recognized text. Documents may contain PII. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Single-line preview of recognized text: newlines flattened, truncated, length appended.
     */
    public static String preview(String text) {
        if (text == null) {
            return "";
        }
        String flat = truncate(text.replace('\n', ' ').replace('\r', ' '), DEFAULT_PREVIEW_CHARS);
        return text.length() > DEFAULT_PREVIEW_CHARS ? flat + "...(" + text.length() + " chars)" : flat;
    }
}
