package de.t14d3.spindle.query;

/**
 * Immutable node of a boolean expression tree over columns. Conditions are
 * rendered to SQL by {@link de.t14d3.spindle.sql.SqlRenderer}; they never
 * execute anything themselves.
 *
 * @see Conditions
 */
public interface Condition {
}
