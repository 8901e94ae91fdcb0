package com.queryforge.safety;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A regex paired with the violation it reports.
 */
record PatternRule(Pattern pattern, String violation) {

    static PatternRule of(String regex, int flags, String violation) {
        return new PatternRule(Pattern.compile(regex, flags), violation);
    }

    boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Append one violation per matching rule.
     */
    static void collect(List<PatternRule> rules, String text, List<String> out) {
        for (PatternRule rule : rules) {
            if (rule.matches(text)) {
                out.add(rule.violation());
            }
        }
    }
}
