package io.hearthwarrio.formschema.core;

import java.util.List;
import java.util.Objects;

/**
 * Raw snapshot of one interactive control as reported by the page-rendering source.
 * <p>
 * Consumed once per extraction pass. Null strings are stored as empty strings,
 * a null option list is stored as an empty list.
 */
public final class RawElement {

    private final String identifier;
    private final String name;
    private final String elementKind;
    private final String tagKind;
    private final String cssClasses;
    private final String placeholder;
    private final boolean required;
    private final boolean disabled;
    private final String currentValue;
    private final String associatedLabel;

    /**
     * Options of select/radio groups in page order. Empty when the control has none.
     */
    private final List<SelectOption> options;

    public RawElement(
            String identifier,
            String name,
            String elementKind,
            String tagKind,
            String cssClasses,
            String placeholder,
            boolean required,
            boolean disabled,
            String currentValue,
            String associatedLabel
    ) {
        this(
                identifier,
                name,
                elementKind,
                tagKind,
                cssClasses,
                placeholder,
                required,
                disabled,
                currentValue,
                associatedLabel,
                List.of()
        );
    }

    public RawElement(
            String identifier,
            String name,
            String elementKind,
            String tagKind,
            String cssClasses,
            String placeholder,
            boolean required,
            boolean disabled,
            String currentValue,
            String associatedLabel,
            List<SelectOption> options
    ) {
        this.identifier = normalizeNull(identifier);
        this.name = normalizeNull(name);
        this.elementKind = normalizeNull(elementKind);
        this.tagKind = normalizeNull(tagKind);
        this.cssClasses = normalizeNull(cssClasses);
        this.placeholder = normalizeNull(placeholder);
        this.required = required;
        this.disabled = disabled;
        this.currentValue = normalizeNull(currentValue);
        this.associatedLabel = normalizeNull(associatedLabel);
        this.options = options == null ? List.of() : List.copyOf(options);
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getName() {
        return name;
    }

    public String getElementKind() {
        return elementKind;
    }

    public String getTagKind() {
        return tagKind;
    }

    public String getCssClasses() {
        return cssClasses;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public String getCurrentValue() {
        return currentValue;
    }

    public String getAssociatedLabel() {
        return associatedLabel;
    }

    public List<SelectOption> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "RawElement{" +
                "identifier='" + identifier + '\'' +
                ", name='" + name + '\'' +
                ", elementKind='" + elementKind + '\'' +
                ", tagKind='" + tagKind + '\'' +
                ", cssClasses='" + cssClasses + '\'' +
                ", placeholder='" + placeholder + '\'' +
                ", required=" + required +
                ", disabled=" + disabled +
                ", associatedLabel='" + associatedLabel + '\'' +
                ", options=" + options.size() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawElement)) return false;
        RawElement that = (RawElement) o;
        return required == that.required &&
                disabled == that.disabled &&
                Objects.equals(identifier, that.identifier) &&
                Objects.equals(name, that.name) &&
                Objects.equals(elementKind, that.elementKind) &&
                Objects.equals(tagKind, that.tagKind) &&
                Objects.equals(cssClasses, that.cssClasses) &&
                Objects.equals(placeholder, that.placeholder) &&
                Objects.equals(currentValue, that.currentValue) &&
                Objects.equals(associatedLabel, that.associatedLabel) &&
                Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                identifier, name, elementKind, tagKind, cssClasses, placeholder,
                required, disabled, currentValue, associatedLabel, options
        );
    }
}
