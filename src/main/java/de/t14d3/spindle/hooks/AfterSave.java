package de.t14d3.spindle.hooks;

/**
 * Invoked after the record was inserted or updated, inside the write transaction. Throwing aborts the operation.
 */
public interface AfterSave {
    void afterSave();
}
