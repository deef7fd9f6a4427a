package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of constraint carried by a {@link ValidationRule}.
 */
public enum RuleType {
    REQUIRED,
    PATTERN,
    LENGTH,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
