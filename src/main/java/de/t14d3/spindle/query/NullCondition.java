package de.t14d3.spindle.query;

import java.util.Objects;

public record NullCondition(String column, boolean negated) implements Condition {
    public NullCondition {
        Objects.requireNonNull(column, "column");
    }
}
