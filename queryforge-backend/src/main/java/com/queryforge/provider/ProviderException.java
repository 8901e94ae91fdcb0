package com.queryforge.provider;

/**
 * Thrown when the completion provider cannot produce a completion.
 */
public class ProviderException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message human-readable detail
     */
    public ProviderException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message human-readable detail
     * @param cause underlying failure
     */
    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
