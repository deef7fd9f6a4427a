package io.hearthwarrio.formschema.core.heuristics;

import io.hearthwarrio.formschema.core.CategoryRule;
import io.hearthwarrio.formschema.core.FieldCategory;
import io.hearthwarrio.formschema.core.NormalizedField;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Category row that matches field attributes by substring.
 * <p>
 * The selected attributes are lower-cased and joined with single spaces, and the row matches
 * when any needle occurs in the joined text. Typical use cases:
 * <ul>
 *   <li>document numbers named after the document ("aadhaar", "pan")</li>
 *   <li>contact details recognizable by label wording ("mobile", "phone")</li>
 *   <li>input types that already carry the semantics ("email")</li>
 * </ul>
 */
public final class KeywordCategoryRule implements CategoryRule {

    /**
     * Field attributes that can be matched.
     */
    public enum Attribute {
        ID,
        NAME,
        LABEL,
        PLACEHOLDER,
        INPUT_TYPE
    }

    private final String id;
    private final int order;
    private final FieldCategory category;
    private final Set<Attribute> attributes;
    private final List<String> needlesLower;

    /**
     * Creates a row.
     *
     * @param id         identifier (used in diagnostics)
     * @param order      order value (lower runs earlier)
     * @param category   category assigned on match
     * @param attributes attributes to search in; defaults to id, name and label
     * @param needles    substrings to search for (case-insensitive)
     */
    public KeywordCategoryRule(
            String id,
            int order,
            FieldCategory category,
            Set<Attribute> attributes,
            List<String> needles
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.order = order;
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.attributes = attributes == null || attributes.isEmpty()
                ? EnumSet.of(Attribute.ID, Attribute.NAME, Attribute.LABEL)
                : EnumSet.copyOf(attributes);
        this.needlesLower = normalizeNeedles(needles);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int order() {
        return order;
    }

    public FieldCategory category() {
        return category;
    }

    @Override
    public Optional<FieldCategory> classify(NormalizedField field) {
        return matches(field) ? Optional.of(category) : Optional.empty();
    }

    private boolean matches(NormalizedField field) {
        if (field == null || needlesLower.isEmpty()) {
            return false;
        }

        String text = joinedText(field);
        if (text.isEmpty()) {
            return false;
        }
        for (String needle : needlesLower) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private String joinedText(NormalizedField field) {
        StringBuilder sb = new StringBuilder();
        for (Attribute a : attributes) {
            String value = read(a, field);
            if (value.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(value);
        }
        return sb.toString();
    }

    private String read(Attribute a, NormalizedField f) {
        return switch (a) {
            case ID -> lower(f.getId());
            case NAME -> lower(f.getName());
            case LABEL -> lower(f.getLabel());
            case PLACEHOLDER -> lower(f.getPlaceholder());
            case INPUT_TYPE -> lower(f.getInputType());
        };
    }

    private String lower(String v) {
        if (v == null) {
            return "";
        }
        return v.trim().toLowerCase(Locale.ROOT);
    }

    private List<String> normalizeNeedles(List<String> needles) {
        if (needles == null || needles.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String n : needles) {
            if (n == null) {
                continue;
            }
            String t = n.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return List.copyOf(out);
    }
}
