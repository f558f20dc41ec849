package de.t14d3.spindle.mapping;

/**
 * Storage classification of a mapped field, resolved once when the schema is built.
 */
public enum FieldKind {
    /** A single value in a plain column. */
    SCALAR,
    /** A list or array stored in a native array column. */
    ARRAY,
    /** An arbitrary value stored as a JSON document. */
    JSON,
    /** An embedded object whose fields are columns of the owning table. */
    INLINE
}
