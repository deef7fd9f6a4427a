package io.hearthwarrio.formschema.core;

import java.util.List;
import java.util.Objects;

/**
 * Category and deduplicated rules produced for one field.
 */
public final class InferredRules {

    private final FieldCategory category;
    private final List<ValidationRule> rules;
    private final boolean fallback;

    public InferredRules(FieldCategory category, List<ValidationRule> rules, boolean fallback) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.fallback = fallback;
    }

    public FieldCategory getCategory() {
        return category;
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    /**
     * @return true when the hint/script stages failed and keyword-only rules were produced
     */
    public boolean isFallback() {
        return fallback;
    }

    /**
     * @param field field the rules were inferred for
     * @return copy of the field carrying this category and these rules
     */
    public NormalizedField applyTo(NormalizedField field) {
        return field.withInference(category, rules);
    }

    @Override
    public String toString() {
        return "InferredRules{category=" + category + ", rules=" + rules + ", fallback=" + fallback + '}';
    }
}
