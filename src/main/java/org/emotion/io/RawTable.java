package org.emotion.io;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reader output before any corpus knowledge is applied.
 *
 * @param names          instance names, one per row
 * @param rows           per-row payload
 * @param labelTokens    raw label token per row, or empty when the source carries no labels
 * @param attributeNames feature names
 * @param corpusId       corpus declared by the source itself, if any
 */
public record RawTable<X>(List<String> names,
                          List<X> rows,
                          List<String> labelTokens,
                          List<String> attributeNames,
                          Optional<String> corpusId) {

    public RawTable {
        Objects.requireNonNull(names, "names must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(labelTokens, "labelTokens must not be null");
        Objects.requireNonNull(attributeNames, "attributeNames must not be null");
        Objects.requireNonNull(corpusId, "corpusId must not be null");
        names = List.copyOf(names);
        rows = List.copyOf(rows);
        labelTokens = List.copyOf(labelTokens);
        attributeNames = List.copyOf(attributeNames);

        if (rows.size() != names.size()) {
            throw new IllegalArgumentException("rows (" + rows.size() + ") and names (" + names.size() + ") differ");
        }
        if (!labelTokens.isEmpty() && labelTokens.size() != names.size()) {
            throw new IllegalArgumentException(
                    "labelTokens (" + labelTokens.size() + ") and names (" + names.size() + ") differ"
            );
        }
    }

    public boolean isLabelled() {
        return !labelTokens.isEmpty() || names.isEmpty();
    }

    public int size() {
        return names.size();
    }
}
