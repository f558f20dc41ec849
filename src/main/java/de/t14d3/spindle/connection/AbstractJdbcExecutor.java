package de.t14d3.spindle.connection;

import de.t14d3.spindle.exceptions.StatementExecutionException;
import de.t14d3.spindle.sql.Dialect;
import de.t14d3.spindle.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Statement execution shared by the pooled and the transactional executor. Subclasses
 * decide where a connection comes from and what happens to it after use.
 */
abstract class AbstractJdbcExecutor implements SqlExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractJdbcExecutor.class);

    protected final Dialect dialect;

    protected AbstractJdbcExecutor(Dialect dialect) {
        this.dialect = dialect;
    }

    protected abstract Connection acquire() throws SQLException;

    protected abstract void release(Connection connection);

    @Override
    public Dialect dialect() {
        return dialect;
    }

    @Override
    public RowCursor query(Statement statement) {
        LOGGER.debug("{}", statement);
        Connection connection = null;
        PreparedStatement stmt = null;
        try {
            connection = acquire();
            stmt = connection.prepareStatement(statement.getSql());
            ParameterBinder.setParameters(stmt, statement.getParameters());
            ResultSet rs = stmt.executeQuery();
            Connection owner = connection;
            return new JdbcRowCursor(statement.getSql(), stmt, rs, () -> release(owner));
        } catch (SQLException e) {
            closeQuietly(stmt, e);
            if (connection != null) {
                release(connection);
            }
            throw failure(statement, e);
        }
    }

    @Override
    public int update(Statement statement) {
        LOGGER.debug("{}", statement);
        Connection connection = null;
        try {
            connection = acquire();
            try (PreparedStatement stmt = connection.prepareStatement(statement.getSql())) {
                ParameterBinder.setParameters(stmt, statement.getParameters());
                return stmt.executeUpdate();
            }
        } catch (SQLException e) {
            throw failure(statement, e);
        } finally {
            if (connection != null) {
                release(connection);
            }
        }
    }

    @Override
    public Object insert(Statement statement, String keyColumn) {
        if (keyColumn == null) {
            update(statement);
            return null;
        }
        LOGGER.debug("{}", statement);
        Connection connection = null;
        try {
            connection = acquire();
            try (PreparedStatement stmt = connection.prepareStatement(statement.getSql(),
                    java.sql.Statement.RETURN_GENERATED_KEYS)) {
                ParameterBinder.setParameters(stmt, statement.getParameters());
                stmt.executeUpdate();

                try (ResultSet rs = stmt.getGeneratedKeys()) {
                    if (rs.next()) {
                        return rs.getObject(1);
                    }
                }
                return null;
            }
        } catch (SQLException e) {
            throw failure(statement, e);
        } finally {
            if (connection != null) {
                release(connection);
            }
        }
    }

    private static StatementExecutionException failure(Statement statement, SQLException e) {
        return new StatementExecutionException(
                "Failed to execute SQL: " + statement.getSql() + " params=" + statement.getParameters(), e);
    }

    private static void closeQuietly(PreparedStatement stmt, SQLException primary) {
        if (stmt == null) {
            return;
        }
        try {
            stmt.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }
}
