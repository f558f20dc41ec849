package de.t14d3.spindle.mapping;

import de.t14d3.spindle.exceptions.SchemaException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Describes one mapped field: its column, storage kind and how to reach it on an
 * instance. Inline fields carry the descriptors of their embedded columns and
 * have no column themselves.
 */
public final class FieldDescriptor {
    private final String name;
    private final String column;
    private final FieldKind kind;
    private final boolean nullable;
    private final List<Field> path;
    private final List<FieldDescriptor> children;

    private FieldDescriptor(String name, String column, FieldKind kind, boolean nullable,
                            List<Field> path, List<FieldDescriptor> children) {
        this.name = name;
        this.column = column;
        this.kind = kind;
        this.nullable = nullable;
        this.path = List.copyOf(path);
        this.children = List.copyOf(children);
        for (Field field : this.path) {
            field.setAccessible(true);
        }
    }

    /**
     * Creates a column-backed descriptor. {@code path} leads from the record to the
     * field, passing through inline containers.
     */
    public static FieldDescriptor column(String column, FieldKind kind, boolean nullable, List<Field> path) {
        if (kind == FieldKind.INLINE) {
            throw new IllegalArgumentException("Inline fields have no column; use FieldDescriptor.inline");
        }
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column must not be blank");
        }
        Field leaf = path.get(path.size() - 1);
        boolean effectiveNullable = nullable && !leaf.getType().isPrimitive();
        return new FieldDescriptor(pathName(path), column, kind, effectiveNullable, path, List.of());
    }

    public static FieldDescriptor inline(List<Field> path, List<FieldDescriptor> children) {
        if (children.isEmpty()) {
            throw new SchemaException("Inline field " + pathName(path) + " maps no columns");
        }
        return new FieldDescriptor(pathName(path), null, FieldKind.INLINE, true, path, children);
    }

    private static String pathName(List<Field> path) {
        List<String> names = new ArrayList<>(path.size());
        for (Field field : path) {
            names.add(field.getName());
        }
        return String.join(".", names);
    }

    /**
     * Dotted field path, e.g. {@code timestamps.createdAt}.
     */
    public String getName() {
        return name;
    }

    /**
     * Column name, or {@code null} for inline containers.
     */
    public String getColumn() {
        return column;
    }

    public FieldKind getKind() {
        return kind;
    }

    public boolean isNullable() {
        return nullable;
    }

    public List<FieldDescriptor> getChildren() {
        return children;
    }

    private Field leaf() {
        return path.get(path.size() - 1);
    }

    public Class<?> getJavaType() {
        return leaf().getType();
    }

    public Type getGenericType() {
        return leaf().getGenericType();
    }

    /**
     * Element type of an array-kind field; {@code Object} when it cannot be resolved.
     */
    public Class<?> getElementType() {
        Class<?> type = getJavaType();
        if (type.isArray()) {
            return type.getComponentType();
        }
        if (Collection.class.isAssignableFrom(type) && getGenericType() instanceof ParameterizedType pt) {
            Type arg = pt.getActualTypeArguments()[0];
            if (arg instanceof Class<?> cls) {
                return cls;
            }
            if (arg instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> raw) {
                return raw;
            }
        }
        return Object.class;
    }

    /**
     * Reads the value from {@code target}; {@code null} when an inline container on
     * the way is unset.
     */
    public Object get(Object target) {
        Object current = target;
        try {
            for (Field field : path) {
                if (current == null) {
                    return null;
                }
                current = field.get(current);
            }
            return current;
        } catch (IllegalAccessException e) {
            throw new SchemaException("Cannot access field " + name, e);
        }
    }

    /**
     * Writes the value to {@code target}, instantiating unset inline containers.
     * A {@code null} value leaves primitive fields untouched.
     */
    public void set(Object target, Object value) {
        Field leaf = leaf();
        if (value == null && leaf.getType().isPrimitive()) {
            return;
        }
        try {
            Object current = target;
            for (int i = 0; i < path.size() - 1; i++) {
                Field field = path.get(i);
                Object next = field.get(current);
                if (next == null) {
                    next = instantiate(field.getType());
                    field.set(current, next);
                }
                current = next;
            }
            leaf.set(current, value);
        } catch (IllegalAccessException e) {
            throw new SchemaException("Cannot set field " + name, e);
        }
    }

    private static Object instantiate(Class<?> type) {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new SchemaException("Cannot instantiate inline type " + type.getName(), e);
        }
    }

    /**
     * This descriptor and, for inline fields, all nested column descriptors.
     */
    List<FieldDescriptor> flatten() {
        if (kind != FieldKind.INLINE) {
            return Collections.singletonList(this);
        }
        List<FieldDescriptor> out = new ArrayList<>();
        for (FieldDescriptor child : children) {
            out.addAll(child.flatten());
        }
        return out;
    }

    @Override
    public String toString() {
        return "FieldDescriptor{" + name + (column != null ? " -> " + column : "") + ", " + kind + '}';
    }
}
