package de.t14d3.spindle.exceptions;

/**
 * The database reported a failure while executing a statement: connectivity,
 * constraint violation, syntax.
 */
public class StatementExecutionException extends SpindleException {
    public StatementExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
