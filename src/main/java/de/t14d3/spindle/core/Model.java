package de.t14d3.spindle.core;

/**
 * Convenience base class for entities.
 */
public abstract class Model implements Record {
    private final transient RecordState recordState = new RecordState();

    @Override
    public RecordState recordState() {
        return recordState;
    }
}
