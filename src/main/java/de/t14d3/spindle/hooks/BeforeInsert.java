package de.t14d3.spindle.hooks;

/**
 * Invoked before the row is inserted. Throwing aborts the operation.
 */
public interface BeforeInsert {
    void beforeInsert();
}
