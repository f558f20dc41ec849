package de.t14d3.spindle.connection;

import de.t14d3.spindle.exceptions.StatementExecutionException;

import java.sql.Array;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * {@link RowCursor} over a JDBC result set. Closing it closes the result set and
 * the statement, then hands the connection back through {@code onClose}.
 */
class JdbcRowCursor implements RowCursor {
    private final String sql;
    private final PreparedStatement statement;
    private final ResultSet resultSet;
    private final int columnCount;
    private final Runnable onClose;
    private boolean closed;

    JdbcRowCursor(String sql, PreparedStatement statement, ResultSet resultSet, Runnable onClose) throws SQLException {
        this.sql = sql;
        this.statement = statement;
        this.resultSet = resultSet;
        this.columnCount = resultSet.getMetaData().getColumnCount();
        this.onClose = onClose;
    }

    @Override
    public boolean next() {
        if (closed) {
            return false;
        }
        try {
            return resultSet.next();
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to advance cursor for SQL: " + sql, e);
        }
    }

    @Override
    public Object get(int index) {
        try {
            Object value = resultSet.getObject(index + 1);
            if (value instanceof Array array) {
                try {
                    return array.getArray();
                } finally {
                    array.free();
                }
            }
            if (value instanceof Clob clob) {
                return clob.getSubString(1, (int) clob.length());
            }
            return value;
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to read column " + (index + 1) + " for SQL: " + sql, e);
        }
    }

    @Override
    public int columnCount() {
        return columnCount;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            try {
                resultSet.close();
            } finally {
                statement.close();
            }
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to close cursor for SQL: " + sql, e);
        } finally {
            onClose.run();
        }
    }
}
