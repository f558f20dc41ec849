package de.t14d3.spindle.sql;

/**
 * Parameter holding an encoded JSON document destined for a JSON column.
 */
public record JsonValue(String json) {
}
