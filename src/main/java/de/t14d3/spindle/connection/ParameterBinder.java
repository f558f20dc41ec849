package de.t14d3.spindle.connection;

import de.t14d3.spindle.sql.ArrayValue;
import de.t14d3.spindle.sql.JsonValue;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * PreparedStatement parameter binding with simple type handling.
 */
final class ParameterBinder {
    private ParameterBinder() {
    }

    static PreparedStatement setParameters(PreparedStatement stmt, List<Object> params) throws SQLException {
        if (params == null || params.isEmpty()) return stmt;

        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int idx = i + 1;

            if (p == null) {
                stmt.setNull(idx, Types.NULL);
            } else if (p instanceof JsonValue json) {
                if (json.json() == null) {
                    stmt.setNull(idx, Types.NULL);
                } else {
                    stmt.setString(idx, json.json());
                }
            } else if (p instanceof ArrayValue array) {
                if (array.elements() == null) {
                    stmt.setNull(idx, Types.ARRAY);
                } else {
                    Array sqlArray = stmt.getConnection().createArrayOf(array.sqlType(), array.elements());
                    stmt.setArray(idx, sqlArray);
                }
            } else if (p instanceof String s) {
                stmt.setString(idx, s);
            } else if (p instanceof Integer integer) {
                stmt.setInt(idx, integer);
            } else if (p instanceof Long l) {
                stmt.setLong(idx, l);
            } else if (p instanceof Boolean b) {
                stmt.setBoolean(idx, b);
            } else if (p instanceof Double v) {
                stmt.setDouble(idx, v);
            } else if (p instanceof Float v) {
                stmt.setFloat(idx, v);
            } else if (p instanceof Short aShort) {
                stmt.setShort(idx, aShort);
            } else if (p instanceof Byte b) {
                stmt.setByte(idx, b);
            } else if (p instanceof java.sql.Date date) {
                stmt.setDate(idx, date);
            } else if (p instanceof Time time) {
                stmt.setTime(idx, time);
            } else if (p instanceof Timestamp timestamp) {
                stmt.setTimestamp(idx, timestamp);
            } else if (p instanceof Date date) {
                stmt.setTimestamp(idx, new Timestamp(date.getTime()));
            } else if (p instanceof LocalDate localDate) {
                stmt.setDate(idx, java.sql.Date.valueOf(localDate));
            } else if (p instanceof LocalDateTime localDateTime) {
                stmt.setTimestamp(idx, Timestamp.valueOf(localDateTime));
            } else if (p instanceof Instant instant) {
                stmt.setTimestamp(idx, Timestamp.from(instant));
            } else if (p instanceof UUID uuid) {
                stmt.setString(idx, uuid.toString());
            } else if (p instanceof Enum<?> anEnum) {
                stmt.setString(idx, anEnum.name());
            } else {
                // fallback - let JDBC try to handle it
                stmt.setObject(idx, p);
            }
        }
        return stmt;
    }
}
