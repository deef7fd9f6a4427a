package io.hearthwarrio.formschema.core;

import java.util.Objects;

/**
 * One entry of a select or radio group.
 */
public final class SelectOption {

    private final String value;
    private final String text;

    public SelectOption(String value, String text) {
        this.value = value == null ? "" : value;
        this.text = text == null ? "" : text;
    }

    public String getValue() {
        return value;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "SelectOption{value='" + value + "', text='" + text + "'}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectOption)) return false;
        SelectOption that = (SelectOption) o;
        return Objects.equals(value, that.value) && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, text);
    }
}
