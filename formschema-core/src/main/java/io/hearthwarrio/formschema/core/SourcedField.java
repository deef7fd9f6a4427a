package io.hearthwarrio.formschema.core;

import java.util.Objects;

/**
 * A normalized field paired with the raw element it came from.
 * The raw identifiers are what the live page understands.
 */
public final class SourcedField {

    private final RawElement source;
    private final NormalizedField field;

    public SourcedField(RawElement source, NormalizedField field) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public RawElement getSource() {
        return source;
    }

    public NormalizedField getField() {
        return field;
    }

    @Override
    public String toString() {
        return "SourcedField{source=" + source.getIdentifier() + ", field=" + field.getId() + '}';
    }
}
