package io.hearthwarrio.formschema.core;

/**
 * Thrown when the calling thread is interrupted while hint lookups are outstanding.
 */
public class ExtractionAbortedException extends RuntimeException {
    public ExtractionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
