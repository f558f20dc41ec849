package de.t14d3.spindle.query;

import java.util.Objects;

/**
 * {@code column <operator> value}.
 */
public record Comparison(String column, Operator operator, Object value) implements Condition {
    public Comparison {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
    }

    public enum Operator {
        EQ("="), NEQ("<>"), LT("<"), LTE("<="), GT(">"), GTE(">="), LIKE("LIKE"), ILIKE("ILIKE");

        private final String sql;

        Operator(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }
}
