package de.t14d3.spindle.query;

import java.util.List;
import java.util.Objects;

/**
 * A structural test on the JSON document stored in a column. Key operators
 * carry {@code keys}; path existence carries the path segments in {@code keys};
 * containment operators carry {@code document}.
 */
public record JsonCondition(String column, Operator operator, List<String> keys, Object document) implements Condition {
    public JsonCondition {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public enum Operator {
        /** The document has the given top-level key. */
        HAS_KEY,
        /** The document has at least one of the given top-level keys. */
        HAS_ANY_KEY,
        /** The document has every one of the given top-level keys. */
        HAS_ALL_KEYS,
        /** The document contains the given document. */
        CONTAINS,
        /** The document is contained by the given document. */
        CONTAINED_BY,
        /** A value exists at the given path. */
        PATH_EXISTS
    }
}
