package de.t14d3.spindle.hooks;

/**
 * Invoked after the row was updated, inside the write transaction. Throwing aborts the operation.
 */
public interface AfterUpdate {
    void afterUpdate();
}
