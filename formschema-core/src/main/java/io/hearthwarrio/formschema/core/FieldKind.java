package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of field kinds a normalized field can have.
 */
public enum FieldKind {
    TEXT,
    SELECT,
    RADIO,
    CHECKBOX,
    BUTTON;

    private static final Map<String, FieldKind> RAW_KINDS = Map.ofEntries(
            Map.entry("text", TEXT),
            Map.entry("email", TEXT),
            Map.entry("tel", TEXT),
            Map.entry("number", TEXT),
            Map.entry("password", TEXT),
            Map.entry("textarea", TEXT),
            Map.entry("select", SELECT),
            Map.entry("select-one", SELECT),
            Map.entry("radio", RADIO),
            Map.entry("checkbox", CHECKBOX),
            Map.entry("button", BUTTON),
            Map.entry("submit", BUTTON)
    );

    /**
     * Maps a raw element kind to a field kind. Unknown or empty kinds map to {@link #TEXT}.
     *
     * @param rawKind raw kind as reported by the page (may be null)
     * @return mapped kind, never null
     */
    public static FieldKind fromRawKind(String rawKind) {
        if (rawKind == null) {
            return TEXT;
        }
        FieldKind kind = RAW_KINDS.get(rawKind.trim().toLowerCase(Locale.ROOT));
        return kind == null ? TEXT : kind;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
