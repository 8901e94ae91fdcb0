package com.queryforge.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips formatting noise (markdown fences, narrative lead-ins) from model output.
 */
public final class ResponseCleaner {

    private static final Pattern OPENING_FENCE =
            Pattern.compile("```(?:sql|json|mongodb|javascript|js)?[ \\t]*\\r?\\n?", Pattern.CASE_INSENSITIVE);
    private static final String FENCE = "```";

    // Checked in order; the first match wins.
    private static final List<String> NARRATIVE_PREFIXES = List.of(
            "Here's the SQL query:",
            "Here's the query:",
            "The query is:",
            "Query:",
            "SQL:",
            "MongoDB:"
    );

    private ResponseCleaner() {
    }

    /**
     * Clean a raw model response down to the bare query.
     *
     * @param raw provider output, may be null
     * @return cleaned query, possibly empty
     */
    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String s = OPENING_FENCE.matcher(raw).replaceAll("");
        s = s.replace(FENCE, "").trim();

        for (String prefix : NARRATIVE_PREFIXES) {
            if (s.regionMatches(true, 0, prefix, 0, prefix.length())) {
                s = s.substring(prefix.length()).trim();
                break;
            }
        }

        return s;
    }
}
