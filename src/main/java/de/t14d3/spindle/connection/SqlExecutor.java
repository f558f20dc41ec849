package de.t14d3.spindle.connection;

import de.t14d3.spindle.sql.Dialect;
import de.t14d3.spindle.sql.Statement;

/**
 * Executes rendered statements. Implementations either borrow a connection per
 * statement or are bound to a single transaction.
 */
public interface SqlExecutor {

    /**
     * Run a query. The caller owns the returned cursor and must close it.
     */
    RowCursor query(Statement statement);

    /**
     * Run an INSERT, UPDATE or DELETE.
     *
     * @return the affected row count
     */
    int update(Statement statement);

    /**
     * Run an INSERT and return the key the database generated.
     *
     * @param keyColumn the generated key column, or {@code null} when nothing is generated
     * @return the generated key, or {@code null}
     */
    Object insert(Statement statement, String keyColumn);

    /**
     * Open a transaction owning a single connection.
     *
     * @throws IllegalStateException when this executor is already transactional
     */
    TransactionalExecutor beginTransaction();

    boolean inTransaction();

    Dialect dialect();
}
