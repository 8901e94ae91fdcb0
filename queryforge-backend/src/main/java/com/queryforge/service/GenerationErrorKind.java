package com.queryforge.service;

/**
 * Machine-distinguishable reasons a generation request failed.
 */
public enum GenerationErrorKind {
    INPUT_SHAPE("INVALID_INPUT"),
    UNSUPPORTED_DIALECT("UNSUPPORTED_DIALECT"),
    PROVIDER_NOT_CONFIGURED("PROVIDER_NOT_CONFIGURED"),
    ROW_LIMIT_OUT_OF_RANGE("ROW_LIMIT_OUT_OF_RANGE"),
    SCHEMA_NOT_FOUND("SCHEMA_NOT_FOUND"),
    PROVIDER_CALL("PROVIDER_ERROR"),
    SAFETY_VIOLATION("UNSAFE_QUERY"),
    UNKNOWN("GENERATION_ERROR");

    private final String code;

    GenerationErrorKind(String code) {
        this.code = code;
    }

    /**
     * @return stable error code exposed to API clients
     */
    public String getCode() {
        return code;
    }
}
