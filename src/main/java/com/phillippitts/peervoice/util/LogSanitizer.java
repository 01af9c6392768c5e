package com.phillippitts.peervoice.util;

/** Utility for privacy-safe logging of transcript and prompt previews. */
public final class LogSanitizer {

    /** Default preview length for user speech in INFO logs. */
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
     * Single-line preview of user speech: newlines collapsed, truncated with an ellipsis marker.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= PREVIEW_CHARS ? flat : truncate(flat, PREVIEW_CHARS) + "...";
    }
}
