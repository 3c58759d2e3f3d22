package com.phillippitts.voicebridge.util;

/** Utility for privacy-safe logging of transcript previews and client keys. */
public final class LogSanitizer {

    private static final int VISIBLE_KEY_CHARS = 4;

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
     * Masks a client key (user id or address) keeping only its first characters.
     * Returns "?" for null or blank keys.
     */
    public static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "?";
        }
        if (key.length() <= VISIBLE_KEY_CHARS) {
            return key.charAt(0) + "***";
        }
        return key.substring(0, VISIBLE_KEY_CHARS) + "***";
    }
}
