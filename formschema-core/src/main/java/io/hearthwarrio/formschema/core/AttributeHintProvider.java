package io.hearthwarrio.formschema.core;

import java.util.List;
import java.util.Optional;

/**
 * Reads live validation attributes of a control from the rendered page.
 * <p>
 * Calls may be slow, may fail and may be made concurrently from worker threads.
 */
public interface AttributeHintProvider {

    /**
     * Looks up the control by raw identifier, falling back to its name.
     *
     * @param identifier raw element identifier (may be empty)
     * @param name       raw element name (may be empty)
     * @return hints, or empty when the control cannot be found
     */
    Optional<AttributeHints> getAttributeHints(String identifier, String name);

    /**
     * Returns the text of inline scripts on the page, used as secondary validation evidence.
     *
     * @return script texts; empty by default
     */
    default List<String> inlineScripts() {
        return List.of();
    }

    /**
     * @return provider that never finds anything
     */
    static AttributeHintProvider none() {
        return (identifier, name) -> Optional.empty();
    }
}
