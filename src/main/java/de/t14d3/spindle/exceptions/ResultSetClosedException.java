package de.t14d3.spindle.exceptions;

public class ResultSetClosedException extends SpindleException {
    public ResultSetClosedException() {
        super("Record set is closed");
    }
}
