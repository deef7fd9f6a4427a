package io.hearthwarrio.formschema.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts over all fields of a {@link FormSchema}.
 */
public final class SchemaStatistics {

    private final int totalSteps;
    private final int totalFields;
    private final Map<String, Integer> fieldsByKind;
    private final Map<String, Integer> fieldsByCategory;
    private final int totalRules;
    private final Map<String, Integer> rulesByType;

    public SchemaStatistics(
            int totalSteps,
            int totalFields,
            Map<String, Integer> fieldsByKind,
            Map<String, Integer> fieldsByCategory,
            int totalRules,
            Map<String, Integer> rulesByType
    ) {
        this.totalSteps = totalSteps;
        this.totalFields = totalFields;
        this.fieldsByKind = copy(fieldsByKind);
        this.fieldsByCategory = copy(fieldsByCategory);
        this.totalRules = totalRules;
        this.rulesByType = copy(rulesByType);
    }

    private static Map<String, Integer> copy(Map<String, Integer> m) {
        return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public int getTotalFields() {
        return totalFields;
    }

    public Map<String, Integer> getFieldsByKind() {
        return fieldsByKind;
    }

    public Map<String, Integer> getFieldsByCategory() {
        return fieldsByCategory;
    }

    public int getTotalRules() {
        return totalRules;
    }

    public Map<String, Integer> getRulesByType() {
        return rulesByType;
    }

    @Override
    public String toString() {
        return "SchemaStatistics{" +
                "totalSteps=" + totalSteps +
                ", totalFields=" + totalFields +
                ", fieldsByKind=" + fieldsByKind +
                ", fieldsByCategory=" + fieldsByCategory +
                ", totalRules=" + totalRules +
                ", rulesByType=" + rulesByType +
                '}';
    }
}
