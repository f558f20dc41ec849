package de.t14d3.spindle.connection;

import de.t14d3.spindle.exceptions.TransactionException;
import de.t14d3.spindle.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A transaction owning one connection with auto-commit disabled. The connection
 * is closed once the transaction commits or rolls back.
 */
class JdbcTransaction extends AbstractJdbcExecutor implements TransactionalExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcTransaction.class);

    private final Connection connection;
    private boolean completed;

    JdbcTransaction(Connection connection, Dialect dialect) {
        super(dialect);
        this.connection = connection;
    }

    @Override
    protected Connection acquire() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        return connection;
    }

    @Override
    protected void release(Connection connection) {
        // the connection stays open until commit or rollback
    }

    @Override
    public TransactionalExecutor beginTransaction() {
        throw new IllegalStateException("Transaction already in progress");
    }

    @Override
    public boolean inTransaction() {
        return !completed;
    }

    @Override
    public void commit() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        completed = true;
        try {
            connection.commit();
        } catch (SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            discard(e);
            throw new TransactionException("Failed to commit transaction", e);
        }
        LOGGER.debug("Transaction committed");
        close();
    }

    @Override
    public void rollback() {
        if (completed) {
            throw new IllegalStateException("Transaction already completed");
        }
        completed = true;
        try {
            connection.rollback();
        } catch (SQLException e) {
            discard(e);
            throw new TransactionException("Failed to roll back transaction", e);
        }
        LOGGER.debug("Transaction rolled back");
        close();
    }

    // only after the transaction ended: re-enabling auto-commit commits pending work
    private void close() {
        try {
            connection.setAutoCommit(true);
            connection.close();
        } catch (SQLException e) {
            LOGGER.warn("Failed to close transaction connection", e);
        }
    }

    // closing with auto-commit still off leaves the pending work uncommitted
    private void discard(SQLException failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
