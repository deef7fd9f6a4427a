package io.hearthwarrio.formschema.core;

import java.util.Optional;

/**
 * Validation attributes read from the live control: {@code pattern}, {@code minlength},
 * {@code maxlength} and {@code title}. Any of them may be absent.
 */
public final class AttributeHints {

    private static final AttributeHints NONE = new AttributeHints(null, null, null, null);

    private final String pattern;
    private final Integer minLength;
    private final Integer maxLength;
    private final String title;

    public AttributeHints(String pattern, Integer minLength, Integer maxLength, String title) {
        this.pattern = blankToNull(pattern);
        this.minLength = minLength == null || minLength <= 0 ? null : minLength;
        this.maxLength = maxLength == null || maxLength <= 0 ? null : maxLength;
        this.title = blankToNull(title);
    }

    /**
     * @return hints with nothing set (the control exists but declares no constraints)
     */
    public static AttributeHints none() {
        return NONE;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public Optional<String> getPattern() {
        return Optional.ofNullable(pattern);
    }

    public Optional<Integer> getMinLength() {
        return Optional.ofNullable(minLength);
    }

    public Optional<Integer> getMaxLength() {
        return Optional.ofNullable(maxLength);
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public boolean hasLengthBounds() {
        return minLength != null || maxLength != null;
    }

    @Override
    public String toString() {
        return "AttributeHints{" +
                "pattern='" + pattern + '\'' +
                ", minLength=" + minLength +
                ", maxLength=" + maxLength +
                ", title='" + title + '\'' +
                '}';
    }
}
