package org.emotion.io.arff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decoded attribute-relation content, the common form of the text and packed encodings.
 *
 * Numeric cells are {@link Double}, string, nominal and date cells are {@link String},
 * missing cells ({@code ?}) are {@code null}.
 */
public record ArffRelation(String relation, List<ArffAttribute> attributes, List<List<Object>> data) {

    public ArffRelation {
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(data, "data must not be null");
        attributes = List.copyOf(attributes);
        List<List<Object>> rows = new ArrayList<>(data.size());
        for (List<Object> row : data) {
            // cells may be null, so List.copyOf is not an option
            rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        data = Collections.unmodifiableList(rows);
    }
}
