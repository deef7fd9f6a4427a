package io.hearthwarrio.formschema.core;

/**
 * Thrown by an {@link ElementSnapshotSource} when a step cannot be read from the page.
 */
public class SnapshotException extends Exception {
    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
