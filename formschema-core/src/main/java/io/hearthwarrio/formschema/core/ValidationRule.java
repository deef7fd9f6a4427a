package io.hearthwarrio.formschema.core;

import java.util.Objects;

/**
 * A single constraint on a field value together with its user-facing message.
 * <p>
 * The value depends on the rule type:
 * {@link Boolean} for required, {@link String} for pattern and custom,
 * {@link LengthBounds} for length.
 */
public final class ValidationRule {

    private final RuleType ruleType;
    private final Object value;
    private final String message;

    private ValidationRule(RuleType ruleType, Object value, String message) {
        this.ruleType = Objects.requireNonNull(ruleType, "ruleType must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.message = message == null ? "" : message;
    }

    public static ValidationRule required(String fieldTitle) {
        return new ValidationRule(RuleType.REQUIRED, Boolean.TRUE, fieldTitle + " is required");
    }

    public static ValidationRule pattern(String regex, String message) {
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("pattern must not be null or blank");
        }
        return new ValidationRule(RuleType.PATTERN, regex, message);
    }

    public static ValidationRule length(LengthBounds bounds) {
        Objects.requireNonNull(bounds, "bounds must not be null");
        return new ValidationRule(RuleType.LENGTH, bounds, bounds.message());
    }

    public static ValidationRule custom(String expression, String message) {
        return new ValidationRule(RuleType.CUSTOM, Objects.requireNonNull(expression, "expression must not be null"), message);
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public Object getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Identity of a rule for deduplication: type plus serialized value. Messages are ignored.
     *
     * @return dedup key
     */
    public String dedupKey() {
        String serialized = value instanceof LengthBounds
                ? ((LengthBounds) value).serialize()
                : String.valueOf(value);
        return ruleType.wireName() + "_" + serialized;
    }

    @Override
    public String toString() {
        return "ValidationRule{" +
                "ruleType=" + ruleType +
                ", value=" + value +
                ", message='" + message + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationRule)) return false;
        ValidationRule that = (ValidationRule) o;
        return ruleType == that.ruleType &&
                Objects.equals(value, that.value) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleType, value, message);
    }
}
