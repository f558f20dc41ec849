package de.t14d3.spindle.exceptions;

/**
 * Model metadata is incomplete or inconsistent.
 */
public class SchemaException extends SpindleException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
