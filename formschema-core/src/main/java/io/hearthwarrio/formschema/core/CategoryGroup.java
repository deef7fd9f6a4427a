package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Broad buckets used by {@link FormSchema#getFieldCategories()}.
 */
public enum CategoryGroup {
    IDENTITY,
    CONTACT,
    LOCATION,
    VERIFICATION,
    PERSONAL,
    BUSINESS,
    GENERAL;

    /**
     * Resolves the bucket of a category by prefix of its id.
     *
     * @param category field category (may be null)
     * @return matching group, {@link #GENERAL} when nothing matches
     */
    public static CategoryGroup of(FieldCategory category) {
        if (category == null) {
            return GENERAL;
        }
        String id = category.id();
        for (CategoryGroup group : values()) {
            if (group != GENERAL && id.startsWith(group.prefix())) {
                return group;
            }
        }
        return GENERAL;
    }

    public String prefix() {
        return key() + "-";
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return key();
    }
}
