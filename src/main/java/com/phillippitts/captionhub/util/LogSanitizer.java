package com.phillippitts.captionhub.util;

/** Utility for privacy-safe logging of caption text. */
public final class LogSanitizer {

    /** Default number of characters of caption text allowed into logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Short single-line preview of caption text, with an ellipsis when truncated.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\n', ' ').replace('\r', ' ');
        return flat.length() <= DEFAULT_PREVIEW_CHARS ? flat : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
