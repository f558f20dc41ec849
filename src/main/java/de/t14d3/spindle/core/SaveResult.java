package de.t14d3.spindle.core;

/**
 * Which branch {@link Store#save} took.
 */
public enum SaveResult {
    INSERTED,
    UPDATED
}
