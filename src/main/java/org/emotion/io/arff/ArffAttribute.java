package org.emotion.io.arff;

import java.util.List;
import java.util.Objects;

/**
 * One declared attribute: its name and type. Nominal attributes carry their allowed values.
 */
public record ArffAttribute(String name, Type type, List<String> nominalValues) {

    public enum Type { NUMERIC, STRING, NOMINAL, DATE }

    public ArffAttribute {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("attribute name must be non-empty");
        }
        Objects.requireNonNull(type, "type must not be null");
        nominalValues = nominalValues == null ? List.of() : List.copyOf(nominalValues);
    }

    public static ArffAttribute numeric(String name) {
        return new ArffAttribute(name, Type.NUMERIC, List.of());
    }

    public static ArffAttribute string(String name) {
        return new ArffAttribute(name, Type.STRING, List.of());
    }

    public static ArffAttribute nominal(String name, List<String> values) {
        return new ArffAttribute(name, Type.NOMINAL, values);
    }
}
