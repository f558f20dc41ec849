package de.t14d3.spindle.hooks;

/**
 * Invoked after the row was inserted, inside the write transaction. Throwing aborts the operation.
 */
public interface AfterInsert {
    void afterInsert();
}
