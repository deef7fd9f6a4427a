package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Optional min/max character bounds of a length rule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LengthBounds {

    private final Integer min;
    private final Integer max;

    public LengthBounds(Integer min, Integer max) {
        this.min = positiveOrNull(min);
        this.max = positiveOrNull(max);
    }

    private static Integer positiveOrNull(Integer v) {
        return v == null || v <= 0 ? null : v;
    }

    public Integer getMin() {
        return min;
    }

    public Integer getMax() {
        return max;
    }

    boolean isEmpty() {
        return min == null && max == null;
    }

    /**
     * Builds the user-facing message for these bounds.
     *
     * @return exact, range, at-least, at-most or "Invalid length" message
     */
    public String message() {
        if (min != null && max != null) {
            if (min.equals(max)) {
                return "Must be exactly " + min + " characters";
            }
            return "Must be between " + min + " and " + max + " characters";
        }
        if (min != null) {
            return "Must be at least " + min + " characters";
        }
        if (max != null) {
            return "Must be no more than " + max + " characters";
        }
        return "Invalid length";
    }

    /**
     * Stable textual form used for rule deduplication.
     */
    String serialize() {
        return "{min:" + (min == null ? "" : min) + ",max:" + (max == null ? "" : max) + "}";
    }

    @Override
    public String toString() {
        return "LengthBounds" + serialize();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LengthBounds)) return false;
        LengthBounds that = (LengthBounds) o;
        return Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }
}
