package com.queryforge.model;

import java.util.List;

/**
 * Outcome of a safety check: safe only when no violation was recorded.
 */
public record SafetyVerdict(boolean safe, List<String> violations) {

    public SafetyVerdict {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static SafetyVerdict of(List<String> violations) {
        return new SafetyVerdict(violations == null || violations.isEmpty(), violations);
    }
}
