package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic purpose of a field, inferred from its identifiers and label.
 * <p>
 * The id is {@code <group>-<detail>}; the group prefix decides the {@link CategoryGroup} bucket.
 */
public enum FieldCategory {
    IDENTITY_AADHAAR("identity-aadhaar"),
    IDENTITY_PAN("identity-pan"),
    VERIFICATION_OTP("verification-otp"),
    CONTACT_MOBILE("contact-mobile"),
    CONTACT_EMAIL("contact-email"),
    LOCATION_PINCODE("location-pincode"),
    LOCATION_CITY("location-city"),
    LOCATION_STATE("location-state"),
    PERSONAL_ADDRESS("personal-address"),
    PERSONAL_NAME("personal-name"),
    GENERAL("general");

    private final String id;

    FieldCategory(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
