package de.t14d3.spindle.connection;

/**
 * Forward-only cursor over the rows of a query. Values are read by zero-based
 * column position. Holds database resources until closed.
 */
public interface RowCursor extends AutoCloseable {

    /**
     * Advance to the next row.
     *
     * @return {@code false} when no row is left
     */
    boolean next();

    /**
     * Value of the column at {@code index} in the current row. SQL arrays come
     * back as {@code Object[]}, character LOBs as {@code String}.
     */
    Object get(int index);

    int columnCount();

    /**
     * Release the cursor. Idempotent.
     */
    @Override
    void close();
}
