package io.hearthwarrio.formschema.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one field: either the fully annotated field, or a minimal
 * fallback field together with the error that caused the fallback.
 */
public final class FieldOutcome {

    private final NormalizedField field;
    private final Throwable error;

    private FieldOutcome(NormalizedField field, Throwable error) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.error = error;
    }

    public static FieldOutcome success(NormalizedField field) {
        return new FieldOutcome(field, null);
    }

    /**
     * @param fallback field carrying the minimal rules (required only, if applicable)
     * @param error    cause of the failure
     */
    public static FieldOutcome failure(NormalizedField fallback, Throwable error) {
        return new FieldOutcome(fallback, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return annotated field on success, the fallback field on failure
     */
    public NormalizedField getField() {
        return field;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "FieldOutcome{field=" + field.getId() + ", success=" + isSuccess() + '}';
    }
}
