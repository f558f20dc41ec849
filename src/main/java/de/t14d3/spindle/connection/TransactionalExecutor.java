package de.t14d3.spindle.connection;

/**
 * An executor bound to one open transaction. After {@link #commit()} or
 * {@link #rollback()} the executor can no longer be used.
 */
public interface TransactionalExecutor extends SqlExecutor {

    /**
     * @throws de.t14d3.spindle.exceptions.TransactionException when the commit fails
     */
    void commit();

    /**
     * @throws de.t14d3.spindle.exceptions.TransactionException when the rollback fails
     */
    void rollback();
}
