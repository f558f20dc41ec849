package de.t14d3.spindle.query;

import java.util.Objects;

public record Negation(Condition child) implements Condition {
    public Negation {
        Objects.requireNonNull(child, "child");
    }
}
