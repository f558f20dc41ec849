package de.t14d3.spindle.exceptions;

/**
 * Base type of every error raised by the mapping engine.
 */
public class SpindleException extends RuntimeException {
    public SpindleException(String message) {
        super(message);
    }

    public SpindleException(Throwable cause) {
        super(cause);
    }

    public SpindleException(String message, Throwable cause) {
        super(message, cause);
    }
}
