package io.hearthwarrio.formschema.core;

import io.hearthwarrio.formschema.core.heuristics.KeywordCategoryRule;
import io.hearthwarrio.formschema.core.heuristics.KeywordCategoryRule.Attribute;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Utility methods for {@link CategoryRule} tables.
 */
public final class CategoryRules {

    private static final Set<Attribute> FIELD_TEXT = EnumSet.of(Attribute.ID, Attribute.NAME, Attribute.LABEL);
    private static final Set<Attribute> FIELD_TEXT_AND_TYPE =
            EnumSet.of(Attribute.ID, Attribute.NAME, Attribute.LABEL, Attribute.INPUT_TYPE);

    private CategoryRules() {
    }

    /**
     * Default keyword table, highest priority first.
     *
     * @return normalized immutable list
     */
    public static List<CategoryRule> defaults() {
        return normalize(List.of(
                keyword("aadhaar", 10, FieldCategory.IDENTITY_AADHAAR, FIELD_TEXT, "aadhaar", "aadhar"),
                keyword("pan", 20, FieldCategory.IDENTITY_PAN, FIELD_TEXT, "pan"),
                keyword("otp", 30, FieldCategory.VERIFICATION_OTP, FIELD_TEXT, "otp", "verification"),
                keyword("mobile", 40, FieldCategory.CONTACT_MOBILE, FIELD_TEXT, "mobile", "phone"),
                keyword("email", 50, FieldCategory.CONTACT_EMAIL, FIELD_TEXT_AND_TYPE, "email"),
                keyword("pincode", 60, FieldCategory.LOCATION_PINCODE, FIELD_TEXT,
                        "pincode", "pin code", "pin_code", "postal"),
                keyword("city", 70, FieldCategory.LOCATION_CITY, FIELD_TEXT, "city"),
                keyword("state", 80, FieldCategory.LOCATION_STATE, FIELD_TEXT, "state"),
                keyword("address", 90, FieldCategory.PERSONAL_ADDRESS, FIELD_TEXT, "address"),
                keyword("name", 100, FieldCategory.PERSONAL_NAME, FIELD_TEXT, "name")
        ));
    }

    /**
     * Normalizes a rule list:
     * <ul>
     *   <li>removes null entries</li>
     *   <li>orders by {@link CategoryRule#order()} then {@link CategoryRule#id()}</li>
     *   <li>deduplicates by {@link CategoryRule#id()} (first one wins)</li>
     * </ul>
     *
     * @param rules input list (may be null)
     * @return normalized immutable list
     */
    public static List<CategoryRule> normalize(List<? extends CategoryRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }

        List<CategoryRule> cleaned = new ArrayList<>();
        for (CategoryRule r : rules) {
            if (r != null) {
                cleaned.add(r);
            }
        }
        cleaned.sort(Comparator.comparingInt(CategoryRule::order).thenComparing(CategoryRule::id));

        Map<String, CategoryRule> byId = new LinkedHashMap<>();
        for (CategoryRule r : cleaned) {
            byId.putIfAbsent(r.id(), r);
        }

        return List.copyOf(byId.values());
    }

    private static CategoryRule keyword(
            String id,
            int order,
            FieldCategory category,
            Set<Attribute> attributes,
            String... needles
    ) {
        return new KeywordCategoryRule(id, order, category, attributes, List.of(needles));
    }
}
