package de.t14d3.spindle.hooks;

/**
 * Invoked before the row is updated. Throwing aborts the operation.
 */
public interface BeforeUpdate {
    void beforeUpdate();
}
