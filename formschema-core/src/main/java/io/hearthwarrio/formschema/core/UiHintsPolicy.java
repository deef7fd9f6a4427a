package io.hearthwarrio.formschema.core;

/**
 * Derives {@link UiHints} from a field's category.
 */
public class UiHintsPolicy {

    private static final String DIGITS_ONLY = "[0-9]*";

    /**
     * @param field categorized field
     * @return hints for the field; neutral defaults when the category has no special handling
     */
    public UiHints hintsFor(NormalizedField field) {
        FieldCategory category = field.getFieldCategory();
        switch (category) {
            case IDENTITY_AADHAAR:
                return new UiHints("numeric", "off", false, DIGITS_ONLY,
                        "Enter 12-digit Aadhaar number", 12, null);
            case VERIFICATION_OTP:
                return new UiHints("numeric", "off", false, DIGITS_ONLY,
                        "Enter 6-digit OTP", 6, null);
            case CONTACT_MOBILE:
            case LOCATION_PINCODE:
                return new UiHints("numeric", "off", false, DIGITS_ONLY, null, null, null);
            case IDENTITY_PAN:
                return new UiHints("text", "off", false, null,
                        "Enter PAN (e.g., ABCDE1234F)", 10, "uppercase");
            case CONTACT_EMAIL:
                return new UiHints("email", "email", false, null, null, null, null);
            case PERSONAL_NAME:
                return new UiHints("text", "name", true, null, null, null, null);
            default:
                return UiHints.defaults();
        }
    }
}
