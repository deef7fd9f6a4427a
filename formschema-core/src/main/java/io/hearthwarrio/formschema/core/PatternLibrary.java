package io.hearthwarrio.formschema.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical validation patterns per field category.
 * <p>
 * Read-only after class initialization.
 */
public final class PatternLibrary {

    private static final Map<FieldCategory, CanonicalPattern> PATTERNS = buildPatterns();

    private PatternLibrary() {
    }

    /**
     * @param category field category
     * @return canonical pattern, empty when the category has none
     */
    public static Optional<CanonicalPattern> lookup(FieldCategory category) {
        if (category == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PATTERNS.get(category));
    }

    /**
     * @param category field category
     * @return expected input format of the category, empty when it has none
     */
    public static Optional<String> expectedFormat(FieldCategory category) {
        return lookup(category).map(CanonicalPattern::getExpectedFormat);
    }

    /**
     * Returns the whole table keyed by category id, in declaration order.
     *
     * @return unmodifiable map
     */
    public static Map<String, CanonicalPattern> asMap() {
        Map<String, CanonicalPattern> out = new LinkedHashMap<>();
        for (Map.Entry<FieldCategory, CanonicalPattern> e : PATTERNS.entrySet()) {
            out.put(e.getKey().id(), e.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    private static Map<FieldCategory, CanonicalPattern> buildPatterns() {
        Map<FieldCategory, CanonicalPattern> m = new EnumMap<>(FieldCategory.class);

        m.put(FieldCategory.IDENTITY_AADHAAR, new CanonicalPattern(
                "^[0-9]{12}$",
                "Aadhaar number must be 12 digits",
                "Indian Aadhaar number validation",
                "12-digit number"
        ));
        m.put(FieldCategory.IDENTITY_PAN, new CanonicalPattern(
                "[A-Za-z]{5}[0-9]{4}[A-Za-z]{1}",
                "PAN must be in format: 5 letters, 4 digits, 1 letter",
                "Indian PAN card validation",
                "ABCDE1234F"
        ));
        m.put(FieldCategory.VERIFICATION_OTP, new CanonicalPattern(
                "^[0-9]{6}$",
                "OTP must be 6 digits",
                "One-time password validation",
                "6-digit number"
        ));
        m.put(FieldCategory.CONTACT_MOBILE, new CanonicalPattern(
                "^[6-9][0-9]{9}$",
                "Mobile number must be 10 digits starting with 6-9",
                "Indian mobile number validation",
                "10-digit number"
        ));
        m.put(FieldCategory.CONTACT_EMAIL, new CanonicalPattern(
                "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$",
                "Please enter a valid email address",
                "Email address validation"
        ));
        m.put(FieldCategory.LOCATION_PINCODE, new CanonicalPattern(
                "^[0-9]{6}$",
                "PIN code must be 6 digits",
                "Indian postal PIN code validation"
        ));

        return Collections.unmodifiableMap(m);
    }
}
