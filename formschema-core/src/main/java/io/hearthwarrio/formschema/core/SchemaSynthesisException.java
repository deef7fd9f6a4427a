package io.hearthwarrio.formschema.core;

/**
 * Thrown when per-step field data cannot be assembled into a schema
 * (unrecognized or missing step).
 */
public class SchemaSynthesisException extends RuntimeException {
    public SchemaSynthesisException(String message) {
        super(message);
    }
}
