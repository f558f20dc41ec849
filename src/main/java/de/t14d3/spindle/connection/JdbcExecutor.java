package de.t14d3.spindle.connection;

import de.t14d3.spindle.exceptions.StatementExecutionException;
import de.t14d3.spindle.exceptions.TransactionException;
import de.t14d3.spindle.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * {@link SqlExecutor} over a {@link DataSource}. Every statement borrows a connection
 * and returns it right away; a query cursor keeps its connection until closed.
 */
public class JdbcExecutor extends AbstractJdbcExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcExecutor.class);

    private final DataSource dataSource;

    public JdbcExecutor(DataSource dataSource) {
        this(dataSource, detectDialect(dataSource));
    }

    public JdbcExecutor(DataSource dataSource, Dialect dialect) {
        super(dialect);
        this.dataSource = dataSource;
    }

    private static Dialect detectDialect(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            Dialect dialect = Dialect.detect(metaData.getDatabaseProductName(), metaData.getURL());
            LOGGER.debug("Detected dialect {} for {}", dialect, metaData.getURL());
            return dialect;
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to detect database dialect", e);
        }
    }

    @Override
    protected Connection acquire() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    protected void release(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StatementExecutionException("Failed to release connection", e);
        }
    }

    @Override
    public TransactionalExecutor beginTransaction() {
        try {
            Connection connection = dataSource.getConnection();
            try {
                connection.setAutoCommit(false);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
            LOGGER.debug("Transaction started");
            return new JdbcTransaction(connection, dialect);
        } catch (SQLException e) {
            throw new TransactionException("Failed to begin transaction", e);
        }
    }

    @Override
    public boolean inTransaction() {
        return false;
    }
}
