package de.t14d3.spindle.hooks;

/**
 * Invoked before the row is deleted. Throwing aborts the operation.
 */
public interface BeforeDelete {
    void beforeDelete();
}
