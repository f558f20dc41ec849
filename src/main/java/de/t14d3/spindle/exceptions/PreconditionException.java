package de.t14d3.spindle.exceptions;

/**
 * A write was attempted on a record whose primary key state does not allow it,
 * e.g. an insert with an unset non-generated key.
 */
public class PreconditionException extends SpindleException {
    public PreconditionException(String message) {
        super(message);
    }
}
