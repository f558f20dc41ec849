package de.t14d3.spindle.mapping;

import de.t14d3.spindle.annotations.Column;
import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.annotations.Id;
import de.t14d3.spindle.annotations.Inline;
import de.t14d3.spindle.annotations.JoinColumn;
import de.t14d3.spindle.annotations.Json;
import de.t14d3.spindle.annotations.OneToMany;
import de.t14d3.spindle.annotations.OneToOne;
import de.t14d3.spindle.annotations.Table;
import de.t14d3.spindle.core.Record;
import de.t14d3.spindle.exceptions.SchemaException;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Builds model descriptors from annotated entity classes.
 */
public final class ModelReader {
    private ModelReader() {
    }

    public static <T extends Record> ModelDescriptor.Builder<T> read(Class<T> entityClass) {
        if (!entityClass.isAnnotationPresent(Entity.class)) {
            throw new SchemaException("Class " + entityClass.getName() + " is not annotated with @Entity");
        }

        ModelDescriptor.Builder<T> builder = ModelDescriptor.builder(entityClass);
        Table table = entityClass.getAnnotation(Table.class);
        if (table != null) {
            builder.table(table.name());
        }

        for (Field field : declaredFields(entityClass)) {
            if (field.isAnnotationPresent(Id.class)) {
                Id id = field.getAnnotation(Id.class);
                builder.primaryKey(FieldDescriptor.column(columnName(field), FieldKind.SCALAR, false, List.of(field)),
                        id.autoIncrement());
            } else if (field.isAnnotationPresent(OneToOne.class)) {
                builder.relationship(oneToOne(entityClass, field));
            } else if (field.isAnnotationPresent(OneToMany.class)) {
                builder.relationship(oneToMany(entityClass, field));
            } else {
                FieldDescriptor descriptor = readField(List.of(field));
                if (descriptor != null) {
                    builder.field(descriptor);
                }
            }
        }
        return builder;
    }

    /**
     * Reads a column-like field at the end of {@code path}; {@code null} when the
     * field is not mapped.
     */
    private static FieldDescriptor readField(List<Field> path) {
        Field field = path.get(path.size() - 1);
        if (field.isAnnotationPresent(Inline.class)) {
            List<FieldDescriptor> children = new ArrayList<>();
            for (Field nested : declaredFields(field.getType())) {
                List<Field> nestedPath = new ArrayList<>(path);
                nestedPath.add(nested);
                FieldDescriptor child = readField(nestedPath);
                if (child != null) {
                    children.add(child);
                }
            }
            return FieldDescriptor.inline(path, children);
        }
        if (field.isAnnotationPresent(Json.class)) {
            Json json = field.getAnnotation(Json.class);
            String column = json.name().isBlank() ? NamingConvention.toSnakeCase(field.getName()) : json.name();
            return FieldDescriptor.column(column, FieldKind.JSON, true, path);
        }
        if (field.isAnnotationPresent(Column.class)) {
            Column column = field.getAnnotation(Column.class);
            return FieldDescriptor.column(columnName(field), isArray(field.getType()) ? FieldKind.ARRAY : FieldKind.SCALAR,
                    column.nullable(), path);
        }
        return null;
    }

    private static boolean isArray(Class<?> type) {
        return (type.isArray() && type != byte[].class) || Collection.class.isAssignableFrom(type);
    }

    private static String columnName(Field field) {
        Column column = field.getAnnotation(Column.class);
        if (column != null && !column.name().isBlank()) {
            return column.name();
        }
        return NamingConvention.toSnakeCase(field.getName());
    }

    private static RelationshipDescriptor oneToOne(Class<?> owner, Field field) {
        OneToOne annotation = field.getAnnotation(OneToOne.class);
        Class<? extends Record> target = asRecordType(field.getType(), owner, field);
        RelationshipDescriptor.Direction direction = annotation.inverse()
                ? RelationshipDescriptor.Direction.INVERSE
                : RelationshipDescriptor.Direction.FORWARD;
        String foreignKey = foreignKey(field, annotation.inverse() ? owner : target);
        return new RelationshipDescriptor(field.getName(), RelationshipDescriptor.Kind.ONE_TO_ONE, direction,
                foreignKey, target, field);
    }

    private static RelationshipDescriptor oneToMany(Class<?> owner, Field field) {
        OneToMany annotation = field.getAnnotation(OneToMany.class);
        if (!List.class.isAssignableFrom(field.getType())) {
            throw new SchemaException("@OneToMany field " + owner.getName() + "." + field.getName() + " must be a List");
        }
        Class<? extends Record> target = asRecordType(annotation.targetEntity(), owner, field);
        return new RelationshipDescriptor(field.getName(), RelationshipDescriptor.Kind.ONE_TO_MANY,
                RelationshipDescriptor.Direction.INVERSE, foreignKey(field, owner), target, field);
    }

    private static String foreignKey(Field field, Class<?> keyOwner) {
        JoinColumn joinColumn = field.getAnnotation(JoinColumn.class);
        if (joinColumn != null && !joinColumn.name().isBlank()) {
            return joinColumn.name();
        }
        return NamingConvention.foreignKeyFor(keyOwner);
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Record> asRecordType(Class<?> type, Class<?> owner, Field field) {
        if (!Record.class.isAssignableFrom(type)) {
            throw new SchemaException("Relationship " + owner.getName() + "." + field.getName()
                    + " targets " + type.getName() + ", which is not a Record");
        }
        return (Class<? extends Record>) type;
    }

    /**
     * Instance fields of {@code type} and its superclasses, superclass fields first.
     */
    private static List<Field> declaredFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                fields.add(field);
            }
        }
        return fields;
    }
}
