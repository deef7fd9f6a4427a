package io.hearthwarrio.formschema.core;

import java.util.Optional;

/**
 * One row of the category classification table.
 * <p>
 * Rows are evaluated in {@link #order()} sequence (ascending) and the first row that
 * returns a category wins, so new categories are added by appending rows.
 * <p>
 * Contract:
 * <ul>
 *   <li>Implementations must be stateless and safe for concurrent use.</li>
 *   <li>{@link #classify(NormalizedField)} must not throw for any well-formed field.</li>
 * </ul>
 */
public interface CategoryRule {

    /**
     * Stable identifier used in diagnostics and for deduplication.
     *
     * @return rule identifier
     */
    default String id() {
        return getClass().getSimpleName();
    }

    /**
     * Lower values run earlier.
     *
     * @return order value
     */
    default int order() {
        return 0;
    }

    /**
     * @param field field to classify
     * @return category when this row matches, otherwise empty
     */
    Optional<FieldCategory> classify(NormalizedField field);
}
