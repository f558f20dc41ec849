package de.t14d3.spindle.exceptions;

public class NoRowsException extends SpindleException {
    public NoRowsException(String message) {
        super(message);
    }
}
