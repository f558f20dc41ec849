package de.t14d3.spindle.exceptions;

/**
 * Update, delete or reload was attempted on a record that was never saved.
 */
public class NotPersistedException extends SpindleException {
    public NotPersistedException(Class<?> recordType) {
        super("Record of type " + recordType.getName() + " is not persisted");
    }
}
