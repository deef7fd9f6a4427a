package io.hearthwarrio.formschema.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Infers a field's validation rules from live attribute hints, its semantic category and
 * inline script evidence.
 * <p>
 * Cascade, each stage only adding rules:
 * <ol>
 *   <li>required rule when the field is required</li>
 *   <li>attribute rules from live hints (pattern, length)</li>
 *   <li>category classification and the category's canonical pattern, unless a pattern exists</li>
 *   <li>inline script patterns when live hints are unavailable, unless a pattern exists</li>
 * </ol>
 * Failures in stages 2-4 are caught per field and replaced by {@link #fallbackRules(NormalizedField)}.
 */
public class ValidationRuleInferencer {

    private static final Logger log = LoggerFactory.getLogger(ValidationRuleInferencer.class);

    static final String DEFAULT_PATTERN_MESSAGE = "Invalid format";

    private final FieldClassifier classifier;
    private final ClientScriptScanner scriptScanner;

    public ValidationRuleInferencer() {
        this(new FieldClassifier(), new ClientScriptScanner());
    }

    public ValidationRuleInferencer(FieldClassifier classifier, ClientScriptScanner scriptScanner) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.scriptScanner = Objects.requireNonNull(scriptScanner, "scriptScanner must not be null");
    }

    /**
     * Infers rules without any live evidence.
     *
     * @param field normalized field
     * @return category and rules
     */
    public InferredRules inferRules(NormalizedField field) {
        return inferRules(field, HintLookup.unavailable());
    }

    /**
     * Infers rules for one field.
     *
     * @param field  normalized field
     * @param lookup outcome of the live hint lookup (null is treated as unavailable)
     * @return category and deduplicated rules; never throws for a non-null field
     */
    public InferredRules inferRules(NormalizedField field, HintLookup lookup) {
        Objects.requireNonNull(field, "field must not be null");
        HintLookup effective = lookup == null ? HintLookup.unavailable() : lookup;

        List<ValidationRule> rules = new ArrayList<>();
        if (field.isRequired()) {
            rules.add(ValidationRule.required(field.title()));
        }

        FieldCategory category;
        try {
            Optional<AttributeHints> hints = effective.getHints();
            hints.ifPresent(h -> addAttributeRules(h, rules));

            category = classifier.classify(field);
            if (!hasPattern(rules)) {
                PatternLibrary.lookup(category).ifPresent(p -> rules.add(p.toRule()));
            }

            if (hints.isEmpty() && !hasPattern(rules)) {
                List<String> found = scriptScanner.findPatterns(field, effective.getInlineScripts());
                if (!found.isEmpty()) {
                    rules.add(ValidationRule.pattern(found.get(0), DEFAULT_PATTERN_MESSAGE));
                }
            }
        } catch (RuntimeException e) {
            log.warn("Rule inference failed for field {} in {}, using keyword fallback: {}",
                    fieldKey(field), field.getStepName(), e.getMessage());
            return fallbackRules(field);
        }

        return new InferredRules(category, deduplicate(rules), false);
    }

    /**
     * Keyword-only rules: the required rule plus the category's canonical pattern.
     * Does not consult live hints or scripts.
     *
     * @param field normalized field
     * @return fallback category and rules
     */
    public InferredRules fallbackRules(NormalizedField field) {
        List<ValidationRule> rules = new ArrayList<>();
        if (field.isRequired()) {
            rules.add(ValidationRule.required(field.title()));
        }
        FieldCategory category = classifier.classify(field);
        PatternLibrary.lookup(category).ifPresent(p -> rules.add(p.toRule()));
        return new InferredRules(category, deduplicate(rules), true);
    }

    private void addAttributeRules(AttributeHints hints, List<ValidationRule> rules) {
        Optional<String> pattern = hints.getPattern();
        if (pattern.isPresent()) {
            rules.add(ValidationRule.pattern(pattern.get(), hints.getTitle().orElse(DEFAULT_PATTERN_MESSAGE)));
        }
        if (hints.hasLengthBounds()) {
            LengthBounds bounds = new LengthBounds(
                    hints.getMinLength().orElse(null),
                    hints.getMaxLength().orElse(null)
            );
            rules.add(ValidationRule.length(bounds));
        }
    }

    private static boolean hasPattern(List<ValidationRule> rules) {
        for (ValidationRule r : rules) {
            if (r.getRuleType() == RuleType.PATTERN) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes rules with the same {@link ValidationRule#dedupKey()}, keeping the first.
     *
     * @param rules rules in cascade order
     * @return deduplicated rules in the same order
     */
    static List<ValidationRule> deduplicate(List<ValidationRule> rules) {
        Map<String, ValidationRule> byKey = new LinkedHashMap<>();
        for (ValidationRule r : rules) {
            byKey.putIfAbsent(r.dedupKey(), r);
        }
        return List.copyOf(byKey.values());
    }

    private static String fieldKey(NormalizedField field) {
        return field.getId().isEmpty() ? field.getName() : field.getId();
    }
}
