package io.hearthwarrio.formschema.core;

import java.util.Objects;

/**
 * A recognized form step: its key (e.g. "step1") and human-readable title/description.
 */
public final class StepDefinition {

    private final String key;
    private final String title;
    private final String description;

    public StepDefinition(String key, String title, String description) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        this.title = title == null ? "" : title;
        this.description = description == null ? "" : description;
    }

    public String getKey() {
        return key;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "StepDefinition{key='" + key + "', title='" + title + "'}";
    }
}
