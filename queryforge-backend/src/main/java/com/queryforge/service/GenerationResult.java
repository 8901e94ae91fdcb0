package com.queryforge.service;

import java.util.List;

/**
 * Outcome of a generation request: either a query or an error, never both.
 */
public class GenerationResult {
    private final String query;
    private final GenerationErrorKind errorKind;
    private final String error;
    private final List<String> violations;

    private GenerationResult(String query, GenerationErrorKind errorKind, String error, List<String> violations) {
        this.query = query;
        this.errorKind = errorKind;
        this.error = error;
        this.violations = violations;
    }

    /**
     * Create a successful result.
     *
     * @param query generated query
     * @return result
     */
    public static GenerationResult success(String query) {
        return new GenerationResult(query, null, null, List.of());
    }

    /**
     * Create a failed result.
     *
     * @param kind failure kind
     * @param error human-readable message
     * @return result
     */
    public static GenerationResult failure(GenerationErrorKind kind, String error) {
        return new GenerationResult("", kind, error, List.of());
    }

    /**
     * Create a failed result for a query rejected by the safety validator.
     *
     * @param error human-readable message
     * @param violations every violation found
     * @return result
     */
    public static GenerationResult unsafe(String error, List<String> violations) {
        return new GenerationResult("", GenerationErrorKind.SAFETY_VIOLATION, error, List.copyOf(violations));
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * @return generated query, empty on failure
     */
    public String getQuery() {
        return query;
    }

    /**
     * @return failure kind, null on success
     */
    public GenerationErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * @return error message, null on success
     */
    public String getError() {
        return error;
    }

    /**
     * @return safety violations; empty unless the kind is {@link GenerationErrorKind#SAFETY_VIOLATION}
     */
    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "GenerationResult[success]"
                : "GenerationResult[" + errorKind + ": " + error + "]";
    }
}
