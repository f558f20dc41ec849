package de.t14d3.spindle.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A test on the elements of an array column.
 */
public record ArrayCondition(String column, Operator operator, List<Object> values) implements Condition {
    public ArrayCondition {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public enum Operator {
        /** The column holds every given value. */
        CONTAINS,
        /** Every element of the column is among the given values. */
        CONTAINED_BY,
        /** The column holds at least one given value. */
        OVERLAPS
    }
}
