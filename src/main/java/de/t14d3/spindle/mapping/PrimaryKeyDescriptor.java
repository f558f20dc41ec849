package de.t14d3.spindle.mapping;

import java.util.UUID;

/**
 * The primary key of a model.
 */
public record PrimaryKeyDescriptor(FieldDescriptor field, boolean autoIncrement) {
    private static final UUID NIL_UUID = new UUID(0L, 0L);

    public PrimaryKeyDescriptor {
        if (field == null || field.getKind() != FieldKind.SCALAR) {
            throw new IllegalArgumentException("primary key must be a scalar field");
        }
    }

    public String column() {
        return field.getColumn();
    }

    public Class<?> javaType() {
        return field.getJavaType();
    }

    public Object get(Object record) {
        return field.get(record);
    }

    /**
     * Sets the key, converting database values (e.g. an {@code Integer} generated
     * key) to the field type.
     */
    public void set(Object record, Object value) {
        field.set(record, TypeMapper.convertToJavaType(value, field.getJavaType()));
    }

    public boolean isEmpty(Object record) {
        return isEmptyValue(get(record));
    }

    /**
     * Whether {@code value} counts as an unset identifier: {@code null}, a zero
     * number, a blank string or the nil UUID.
     */
    public static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Number number) {
            return number.longValue() == 0L;
        }
        if (value instanceof CharSequence chars) {
            return chars.toString().isBlank();
        }
        if (value instanceof UUID uuid) {
            return NIL_UUID.equals(uuid);
        }
        return false;
    }
}
