package de.t14d3.spindle.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Set membership, {@code column [NOT] IN (values)}.
 */
public record InCondition(String column, List<Object> values, boolean negated) implements Condition {
    public InCondition {
        Objects.requireNonNull(column, "column");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }
}
