package com.phillippitts.voiceinventory.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    static final int PREVIEW_LENGTH = 40;

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
     * Short single-line preview with an ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replace('\n', ' ').replace('\r', ' ');
        return oneLine.length() <= PREVIEW_LENGTH ? oneLine : truncate(oneLine, PREVIEW_LENGTH) + "...";
    }
}
