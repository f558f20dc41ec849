package de.t14d3.spindle.mapping;

import de.t14d3.spindle.exceptions.SpindleException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Centralized type mapping utilities for converting between Java types and SQL types,
 * and for converting database values to Java types.
 */
public class TypeMapper {

    /**
     * Convert a Java class to its corresponding SQL type string. Used to name the
     * element type of array parameters.
     */
    public static String javaTypeToSqlType(Class<?> javaType) {
        if (javaType == String.class || javaType == UUID.class || javaType.isEnum()) {
            return "VARCHAR";
        } else if (javaType == Long.class || javaType == long.class) {
            return "BIGINT";
        } else if (javaType == Integer.class || javaType == int.class) {
            return "INTEGER";
        } else if (javaType == Short.class || javaType == short.class) {
            return "SMALLINT";
        } else if (javaType == Double.class || javaType == double.class) {
            return "DOUBLE";
        } else if (javaType == Float.class || javaType == float.class) {
            return "REAL";
        } else if (javaType == Boolean.class || javaType == boolean.class) {
            return "BOOLEAN";
        } else if (javaType == LocalDate.class) {
            return "DATE";
        } else if (javaType == LocalDateTime.class || javaType == Timestamp.class) {
            return "TIMESTAMP";
        } else if (javaType == BigDecimal.class) {
            return "DECIMAL";
        }
        return "VARCHAR";
    }

    /**
     * Convert a database value to the target Java type.
     * Handles type coercion where appropriate (e.g., Number -> int, long, float, double).
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object convertToJavaType(Object value, Class<?> targetType) {
        if (value == null) return null;
        if (targetType.isInstance(value) && !(value instanceof java.util.Date)) return value;

        if (targetType == Long.class || targetType == long.class) {
            if (value instanceof Number) return ((Number) value).longValue();
            if (value instanceof String) return Long.parseLong((String) value);
        } else if (targetType == Integer.class || targetType == int.class) {
            if (value instanceof Number) return ((Number) value).intValue();
            if (value instanceof String) return Integer.parseInt((String) value);
        } else if (targetType == Double.class || targetType == double.class) {
            if (value instanceof Number) return ((Number) value).doubleValue();
        } else if (targetType == Float.class || targetType == float.class) {
            if (value instanceof Number) return ((Number) value).floatValue();
        } else if (targetType == Short.class || targetType == short.class) {
            if (value instanceof Number) return ((Number) value).shortValue();
        } else if (targetType == Byte.class || targetType == byte.class) {
            if (value instanceof Number) return ((Number) value).byteValue();
        } else if (targetType == UUID.class) {
            if (value instanceof String) return UUID.fromString((String) value);
        } else if (targetType == String.class) {
            if (value instanceof Clob) return readClob((Clob) value);
            return value.toString();
        } else if (targetType == Boolean.class || targetType == boolean.class) {
            if (value instanceof Number) return ((Number) value).intValue() != 0;
            return Boolean.parseBoolean(value.toString());
        } else if (targetType.isEnum()) {
            return Enum.valueOf((Class<? extends Enum>) targetType, value.toString());
        } else if (targetType == java.util.Date.class) {
            if (value instanceof java.util.Date) {
                return new java.util.Date(((java.util.Date) value).getTime());
            } else if (value instanceof LocalDateTime) {
                return java.util.Date.from(((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant());
            }
        } else if (targetType == LocalDate.class) {
            if (value instanceof java.sql.Date) {
                return ((java.sql.Date) value).toLocalDate();
            } else if (value instanceof Timestamp) {
                return ((Timestamp) value).toLocalDateTime().toLocalDate();
            } else if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toLocalDate();
            }
        } else if (targetType == LocalDateTime.class) {
            if (value instanceof Timestamp) {
                return ((Timestamp) value).toLocalDateTime();
            } else if (value instanceof java.sql.Date) {
                return ((java.sql.Date) value).toLocalDate().atStartOfDay();
            } else if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).toLocalDateTime();
            }
        } else if (targetType == Instant.class) {
            if (value instanceof Timestamp) {
                return ((Timestamp) value).toInstant();
            } else if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).toInstant();
            } else if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
            }
        } else if (targetType == BigDecimal.class) {
            if (value instanceof BigInteger) {
                return new BigDecimal((BigInteger) value);
            } else if (value instanceof Number) {
                return new BigDecimal(value.toString());
            } else if (value instanceof String) {
                return new BigDecimal((String) value);
            }
        } else if (targetType == byte[].class) {
            if (value instanceof Blob) {
                try {
                    return ((Blob) value).getBytes(1, (int) ((Blob) value).length());
                } catch (SQLException e) {
                    throw new SpindleException("Failed to read blob", e);
                }
            }
        }

        // For types we don't explicitly handle, return as-is and let the field
        // assignment fail with a clear message if the type does not match.
        return value;
    }

    /**
     * Convert a database array (already unwrapped to {@code Object[]} or a
     * collection, or JSON array text) into the container type of an array-kind field.
     */
    public static Object convertToArrayField(Object value, Class<?> containerType, Class<?> elementType) {
        if (value == null) return null;

        if (value instanceof String || value instanceof byte[]) {
            // arrays kept in a JSON column
            value = JsonCodec.decode(value, Object[].class);
        }

        List<Object> elements = new ArrayList<>();
        if (value instanceof Object[] objects) {
            for (Object element : objects) {
                elements.add(convertToJavaType(element, elementType));
            }
        } else if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                elements.add(convertToJavaType(element, elementType));
            }
        } else if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                elements.add(convertToJavaType(Array.get(value, i), elementType));
            }
        } else {
            throw new SpindleException("Cannot convert " + value.getClass().getName() + " to an array field");
        }

        if (containerType.isArray()) {
            Object array = Array.newInstance(elementType, elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Array.set(array, i, elements.get(i));
            }
            return array;
        }
        if (Set.class.isAssignableFrom(containerType)) {
            return new LinkedHashSet<>(elements);
        }
        return elements;
    }

    /**
     * Flatten an array-kind field value into the element array bound as a SQL array.
     */
    public static Object[] toArrayElements(Object value) {
        if (value == null) return null;
        if (value instanceof Collection<?> collection) {
            return normalizeElements(collection.toArray());
        }
        if (value instanceof Object[] objects) {
            return normalizeElements(objects.clone());
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object[] elements = new Object[length];
            for (int i = 0; i < length; i++) {
                elements[i] = Array.get(value, i);
            }
            return elements;
        }
        throw new SpindleException("Value of type " + value.getClass().getName() + " is not an array");
    }

    private static Object[] normalizeElements(Object[] elements) {
        for (int i = 0; i < elements.length; i++) {
            Object element = elements[i];
            if (element instanceof Enum<?> e) {
                elements[i] = e.name();
            } else if (element instanceof UUID) {
                elements[i] = element.toString();
            }
        }
        return elements;
    }

    private static String readClob(Clob clob) {
        try {
            return clob.getSubString(1, (int) clob.length());
        } catch (SQLException e) {
            throw new SpindleException("Failed to read clob", e);
        }
    }
}
