package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned, step-organized schema of a multi-step form.
 * <p>
 * Assembled once per run by {@link SchemaSynthesizer} and not modified afterwards.
 */
@JsonPropertyOrder({
        "version", "generatedAt", "sourceIdentifier", "metadata", "steps",
        "globalValidationRules", "fieldCategories", "statistics"
})
public final class FormSchema {

    private final String version;
    private final Instant generatedAt;
    private final String sourceIdentifier;
    private final SchemaMetadata metadata;
    private final Map<String, List<NormalizedField>> steps;
    private final Map<String, CanonicalPattern> globalValidationRules;
    private final Map<CategoryGroup, List<NormalizedField>> fieldCategories;
    private final SchemaStatistics statistics;

    public FormSchema(
            String version,
            Instant generatedAt,
            String sourceIdentifier,
            SchemaMetadata metadata,
            Map<String, List<NormalizedField>> steps,
            Map<String, CanonicalPattern> globalValidationRules,
            Map<CategoryGroup, List<NormalizedField>> fieldCategories,
            SchemaStatistics statistics
    ) {
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.sourceIdentifier = sourceIdentifier == null ? "" : sourceIdentifier;
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.steps = freeze(steps);
        this.globalValidationRules = Collections.unmodifiableMap(new LinkedHashMap<>(globalValidationRules));
        this.fieldCategories = freeze(fieldCategories);
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
    }

    private static <K> Map<K, List<NormalizedField>> freeze(Map<K, List<NormalizedField>> in) {
        Map<K, List<NormalizedField>> out = new LinkedHashMap<>();
        for (Map.Entry<K, List<NormalizedField>> e : in.entrySet()) {
            out.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    public String getVersion() {
        return version;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public String getSourceIdentifier() {
        return sourceIdentifier;
    }

    public SchemaMetadata getMetadata() {
        return metadata;
    }

    /**
     * @return step key to fields, in catalog order
     */
    public Map<String, List<NormalizedField>> getSteps() {
        return steps;
    }

    /**
     * @return canonical pattern table keyed by category id, independent of the fields found
     */
    public Map<String, CanonicalPattern> getGlobalValidationRules() {
        return globalValidationRules;
    }

    /**
     * @return every field placed in exactly one broad bucket
     */
    public Map<CategoryGroup, List<NormalizedField>> getFieldCategories() {
        return fieldCategories;
    }

    public SchemaStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "FormSchema{" +
                "version='" + version + '\'' +
                ", generatedAt=" + generatedAt +
                ", sourceIdentifier='" + sourceIdentifier + '\'' +
                ", steps=" + steps.keySet() +
                ", statistics=" + statistics +
                '}';
    }
}
