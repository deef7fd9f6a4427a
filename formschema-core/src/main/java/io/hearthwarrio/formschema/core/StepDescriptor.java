package io.hearthwarrio.formschema.core;

/**
 * Per-step entry of {@link SchemaMetadata}.
 */
public final class StepDescriptor {

    private final String name;
    private final String description;
    private final int fieldCount;

    public StepDescriptor(String name, String description, int fieldCount) {
        this.name = name;
        this.description = description;
        this.fieldCount = fieldCount;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public int getFieldCount() {
        return fieldCount;
    }

    @Override
    public String toString() {
        return "StepDescriptor{name='" + name + "', fieldCount=" + fieldCount + '}';
    }
}
