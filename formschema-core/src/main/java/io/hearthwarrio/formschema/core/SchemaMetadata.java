package io.hearthwarrio.formschema.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive counts and texts stamped onto a {@link FormSchema}.
 */
public final class SchemaMetadata {

    private final int totalSteps;
    private final int totalFields;
    private final String description;
    private final String extractionMethod;
    private final Instant lastUpdated;
    private final Map<String, StepDescriptor> steps;

    public SchemaMetadata(
            int totalSteps,
            int totalFields,
            String description,
            String extractionMethod,
            Instant lastUpdated,
            Map<String, StepDescriptor> steps
    ) {
        this.totalSteps = totalSteps;
        this.totalFields = totalFields;
        this.description = description == null ? "" : description;
        this.extractionMethod = extractionMethod == null ? "" : extractionMethod;
        this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
        this.steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public int getTotalFields() {
        return totalFields;
    }

    public String getDescription() {
        return description;
    }

    public String getExtractionMethod() {
        return extractionMethod;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public Map<String, StepDescriptor> getSteps() {
        return steps;
    }
}
