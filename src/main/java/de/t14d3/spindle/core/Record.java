package de.t14d3.spindle.core;

/**
 * Capability every mapped type offers to the engine. Column and relationship
 * values are reached through the type's {@link de.t14d3.spindle.mapping.ModelDescriptor};
 * the per-instance bookkeeping lives in the {@link RecordState}.
 *
 * @see Model
 */
public interface Record {
    /**
     * Engine bookkeeping for this instance.
     */
    RecordState recordState();

    default boolean isPersisted() {
        return recordState().isPersisted();
    }

    default boolean isWritable() {
        return recordState().isWritable();
    }
}
