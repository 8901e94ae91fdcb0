package com.queryforge.util;

import java.util.regex.Pattern;

/**
 * Normalizes raw user text before any other processing.
 *
 * Removes ASCII control characters (tab, newline and carriage return are kept and then collapsed),
 * caps the length and collapses whitespace runs (Unicode spaces included) to a single space.
 */
public final class InputSanitizer {

    public static final int MAX_LENGTH = 2000;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private InputSanitizer() {
    }

    /**
     * Sanitize user text.
     *
     * @param text raw text, may be null
     * @return sanitized text, never null
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String s = CONTROL_CHARS.matcher(text).replaceAll("");

        if (s.length() > MAX_LENGTH) {
            s = s.substring(0, MAX_LENGTH);
        }

        return WHITESPACE_RUN.matcher(s).replaceAll(" ").strip();
    }
}
