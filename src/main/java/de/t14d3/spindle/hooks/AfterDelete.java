package de.t14d3.spindle.hooks;

/**
 * Invoked after the row was deleted, inside the write transaction. Throwing aborts the operation.
 */
public interface AfterDelete {
    void afterDelete();
}
