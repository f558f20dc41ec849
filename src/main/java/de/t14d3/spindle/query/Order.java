package de.t14d3.spindle.query;

import java.util.Objects;

public record Order(String column, boolean descending) {
    public Order {
        Objects.requireNonNull(column, "column");
    }

    public static Order asc(String column) {
        return new Order(column, false);
    }

    public static Order desc(String column) {
        return new Order(column, true);
    }
}
