package de.t14d3.spindle.exceptions;

/**
 * Commit or rollback of a transaction failed. When a rollback fails while
 * handling another error, this exception is attached to that error as a
 * suppressed exception.
 */
public class TransactionException extends SpindleException {
    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
