package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Reference regular expression for a field category, with the message shown on mismatch
 * and, for some categories, a human-readable example of the expected input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CanonicalPattern {

    private final String pattern;
    private final String message;
    private final String description;
    private final String expectedFormat;

    public CanonicalPattern(String pattern, String message, String description) {
        this(pattern, message, description, null);
    }

    public CanonicalPattern(String pattern, String message, String description, String expectedFormat) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.description = description == null ? "" : description;
        this.expectedFormat = expectedFormat == null || expectedFormat.isBlank() ? null : expectedFormat;
    }

    public String getPattern() {
        return pattern;
    }

    public String getMessage() {
        return message;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return example of the expected input (e.g. "ABCDE1234F"), or null when the category has none
     */
    public String getExpectedFormat() {
        return expectedFormat;
    }

    /**
     * @return a pattern rule carrying this pattern and message
     */
    public ValidationRule toRule() {
        return ValidationRule.pattern(pattern, message);
    }

    @Override
    public String toString() {
        return "CanonicalPattern{pattern='" + pattern + "', message='" + message + "'}";
    }
}
