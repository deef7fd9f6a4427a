package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Cleaned, categorized and rule-annotated representation of one form control.
 * <p>
 * Immutable. Later pipeline stages derive copies through the {@code with*} methods.
 * A field always has a non-empty id or name.
 */
@JsonPropertyOrder({
        "id", "name", "kind", "inputType", "label", "placeholder", "required",
        "options", "stepName", "fieldIndex", "fieldCategory", "expectedFormat", "validationRules", "uiHints"
})
public final class NormalizedField {

    private final String id;
    private final String name;
    private final FieldKind kind;
    private final String inputType;
    private final String label;
    private final String placeholder;
    private final boolean required;
    private final List<SelectOption> options;
    private final String stepName;
    private final int fieldIndex;
    private final FieldCategory fieldCategory;
    private final List<ValidationRule> validationRules;
    private final UiHints uiHints;
    private final String expectedFormat;

    public NormalizedField(
            String id,
            String name,
            FieldKind kind,
            String inputType,
            String label,
            String placeholder,
            boolean required,
            List<SelectOption> options,
            String stepName,
            int fieldIndex
    ) {
        this(id, name, kind, inputType, label, placeholder, required, options, stepName, fieldIndex,
                FieldCategory.GENERAL, List.of(), UiHints.defaults(), null);
    }

    public NormalizedField(
            String id,
            String name,
            FieldKind kind,
            String inputType,
            String label,
            String placeholder,
            boolean required,
            List<SelectOption> options,
            String stepName,
            int fieldIndex,
            FieldCategory fieldCategory,
            List<ValidationRule> validationRules,
            UiHints uiHints,
            String expectedFormat
    ) {
        this.id = id == null ? "" : id;
        this.name = name == null ? "" : name;
        if (this.id.isEmpty() && this.name.isEmpty()) {
            throw new IllegalArgumentException("field must have a non-empty id or name");
        }
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.inputType = inputType == null ? "" : inputType;
        this.label = label == null ? "" : label;
        this.placeholder = placeholder == null ? "" : placeholder;
        this.required = required;
        this.options = options == null ? List.of() : List.copyOf(options);
        this.stepName = stepName == null ? "" : stepName;
        this.fieldIndex = fieldIndex;
        this.fieldCategory = fieldCategory == null ? FieldCategory.GENERAL : fieldCategory;
        this.validationRules = validationRules == null ? List.of() : List.copyOf(validationRules);
        this.uiHints = uiHints == null ? UiHints.defaults() : uiHints;
        this.expectedFormat = expectedFormat == null || expectedFormat.isBlank() ? null : expectedFormat;
    }

    public NormalizedField withFieldIndex(int index) {
        return new NormalizedField(id, name, kind, inputType, label, placeholder, required, options, stepName,
                index, fieldCategory, validationRules, uiHints, expectedFormat);
    }

    public NormalizedField withInference(FieldCategory category, List<ValidationRule> rules) {
        return new NormalizedField(id, name, kind, inputType, label, placeholder, required, options, stepName,
                fieldIndex, category, rules, uiHints, expectedFormat);
    }

    public NormalizedField withUiHints(UiHints hints) {
        return new NormalizedField(id, name, kind, inputType, label, placeholder, required, options, stepName,
                fieldIndex, fieldCategory, validationRules, hints, expectedFormat);
    }

    public NormalizedField withExpectedFormat(String format) {
        return new NormalizedField(id, name, kind, inputType, label, placeholder, required, options, stepName,
                fieldIndex, fieldCategory, validationRules, uiHints, format);
    }

    /**
     * Human-readable title used in messages: the label, or the name when the label is empty.
     *
     * @return display title
     */
    public String title() {
        if (!label.isEmpty()) {
            return label;
        }
        return name.isEmpty() ? id : name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    /**
     * Lower-cased raw input type (e.g. "email", "tel") before kind mapping.
     */
    public String getInputType() {
        return inputType;
    }

    public String getLabel() {
        return label;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public boolean isRequired() {
        return required;
    }

    public List<SelectOption> getOptions() {
        return options;
    }

    public String getStepName() {
        return stepName;
    }

    public int getFieldIndex() {
        return fieldIndex;
    }

    public FieldCategory getFieldCategory() {
        return fieldCategory;
    }

    public List<ValidationRule> getValidationRules() {
        return validationRules;
    }

    public UiHints getUiHints() {
        return uiHints;
    }

    /**
     * @return example of the expected input for the field's category, or null
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getExpectedFormat() {
        return expectedFormat;
    }

    @Override
    public String toString() {
        return "NormalizedField{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", kind=" + kind +
                ", label='" + label + '\'' +
                ", required=" + required +
                ", stepName='" + stepName + '\'' +
                ", fieldIndex=" + fieldIndex +
                ", fieldCategory=" + fieldCategory +
                ", validationRules=" + validationRules.size() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedField)) return false;
        NormalizedField that = (NormalizedField) o;
        return required == that.required &&
                fieldIndex == that.fieldIndex &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                kind == that.kind &&
                Objects.equals(inputType, that.inputType) &&
                Objects.equals(label, that.label) &&
                Objects.equals(placeholder, that.placeholder) &&
                Objects.equals(options, that.options) &&
                Objects.equals(stepName, that.stepName) &&
                fieldCategory == that.fieldCategory &&
                Objects.equals(validationRules, that.validationRules) &&
                Objects.equals(uiHints, that.uiHints) &&
                Objects.equals(expectedFormat, that.expectedFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, kind, inputType, label, placeholder, required, options, stepName,
                fieldIndex, fieldCategory, validationRules, uiHints, expectedFormat);
    }
}
