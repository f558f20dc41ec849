package de.t14d3.spindle.sql;

import java.util.Arrays;

/**
 * Parameter bound as a SQL array through {@link java.sql.Connection#createArrayOf}.
 *
 * @param sqlType  the element type name, e.g. {@code VARCHAR}
 * @param elements the elements; {@code null} binds SQL NULL
 */
public record ArrayValue(String sqlType, Object[] elements) {

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayValue other
                && sqlType.equals(other.sqlType)
                && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return 31 * sqlType.hashCode() + Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return sqlType + Arrays.toString(elements);
    }
}
