package io.hearthwarrio.formschema.core;

import java.util.List;
import java.util.Optional;

/**
 * Assigns a {@link FieldCategory} by walking an ordered {@link CategoryRule} table.
 */
public final class FieldClassifier {

    private final List<CategoryRule> rules;

    public FieldClassifier() {
        this(CategoryRules.defaults());
    }

    /**
     * @param rules classification rows (may be empty; then every field is {@link FieldCategory#GENERAL})
     */
    public FieldClassifier(List<? extends CategoryRule> rules) {
        this.rules = CategoryRules.normalize(rules);
    }

    /**
     * Returns the rows in their effective application order.
     *
     * @return immutable list
     */
    public List<CategoryRule> rules() {
        return rules;
    }

    /**
     * @param field field to classify
     * @return category of the first matching row, {@link FieldCategory#GENERAL} when none matches
     */
    public FieldCategory classify(NormalizedField field) {
        for (CategoryRule rule : rules) {
            Optional<FieldCategory> category = rule.classify(field);
            if (category.isPresent()) {
                return category.get();
            }
        }
        return FieldCategory.GENERAL;
    }
}
