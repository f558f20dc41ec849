package de.t14d3.spindle.hooks;

/**
 * Invoked before the record is inserted or updated. Throwing aborts the operation.
 */
public interface BeforeSave {
    void beforeSave();
}
