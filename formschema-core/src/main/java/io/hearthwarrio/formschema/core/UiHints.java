package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Rendering hints for a frontend form built from the schema.
 * Unset optional hints are omitted from the JSON document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class UiHints {

    private static final UiHints DEFAULTS = new UiHints("text", "off", false, null, null, null, null);

    private final String inputMode;
    private final String autoComplete;
    private final boolean spellCheck;
    private final String pattern;
    private final String placeholder;
    private final Integer maxLength;
    private final String textTransform;

    public UiHints(
            String inputMode,
            String autoComplete,
            boolean spellCheck,
            String pattern,
            String placeholder,
            Integer maxLength,
            String textTransform
    ) {
        this.inputMode = Objects.requireNonNull(inputMode, "inputMode must not be null");
        this.autoComplete = Objects.requireNonNull(autoComplete, "autoComplete must not be null");
        this.spellCheck = spellCheck;
        this.pattern = pattern;
        this.placeholder = placeholder;
        this.maxLength = maxLength;
        this.textTransform = textTransform;
    }

    /**
     * @return neutral hints: text input, autocomplete off, no spellcheck
     */
    public static UiHints defaults() {
        return DEFAULTS;
    }

    public String getInputMode() {
        return inputMode;
    }

    public String getAutoComplete() {
        return autoComplete;
    }

    public boolean isSpellCheck() {
        return spellCheck;
    }

    public String getPattern() {
        return pattern;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public String getTextTransform() {
        return textTransform;
    }

    @Override
    public String toString() {
        return "UiHints{" +
                "inputMode='" + inputMode + '\'' +
                ", autoComplete='" + autoComplete + '\'' +
                ", spellCheck=" + spellCheck +
                ", pattern='" + pattern + '\'' +
                ", placeholder='" + placeholder + '\'' +
                ", maxLength=" + maxLength +
                ", textTransform='" + textTransform + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UiHints)) return false;
        UiHints that = (UiHints) o;
        return spellCheck == that.spellCheck &&
                Objects.equals(inputMode, that.inputMode) &&
                Objects.equals(autoComplete, that.autoComplete) &&
                Objects.equals(pattern, that.pattern) &&
                Objects.equals(placeholder, that.placeholder) &&
                Objects.equals(maxLength, that.maxLength) &&
                Objects.equals(textTransform, that.textTransform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputMode, autoComplete, spellCheck, pattern, placeholder, maxLength, textTransform);
    }
}
