package com.queryforge.schema;

/**
 * Thrown when the schema store cannot write or remove a schema.
 */
public class SchemaStoreException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying I/O failure
     */
    public SchemaStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
