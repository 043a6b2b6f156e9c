package com.phillippitts.speechgate.util;

/** Privacy-safe previews of transcripts and synthesis text for log lines. */
public final class LogSanitizer {

    /** Default preview length. */
    public static final int PREVIEW_CHARS = 30;

    private LogSanitizer() {}

    /**
     * Truncates to at most {@code max} code points and appends "..." when cut; "" for null.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        int codePoints = s.codePointCount(0, s.length());
        if (codePoints <= max) {
            return s;
        }
        return s.substring(0, s.offsetByCodePoints(0, max)) + "...";
    }

    public static String preview(String s) {
        return preview(s, PREVIEW_CHARS);
    }
}
