package de.t14d3.spindle.exceptions;

/**
 * A write was attempted on a record loaded through a partial projection or a
 * filtered relationship. Reload the record to make it writable again.
 */
public class NotWritableException extends SpindleException {
    public NotWritableException(Class<?> recordType) {
        super("Record of type " + recordType.getName() + " is not writable; reload it before writing");
    }
}
