package de.t14d3.spindle.mapping;

import de.t14d3.spindle.core.Record;
import de.t14d3.spindle.exceptions.SchemaException;

import java.lang.reflect.Field;

/**
 * Represents a relationship slot on a model.
 *
 * @param name        the field name, used to address the relationship in queries
 * @param kind        one-to-one or one-to-many
 * @param direction   which table stores the foreign key
 * @param foreignKey  the foreign key column
 * @param targetType  the related record type
 * @param field       the slot holding the related record(s)
 */
public record RelationshipDescriptor(String name, Kind kind, Direction direction, String foreignKey,
                                     Class<? extends Record> targetType, Field field) {
    public RelationshipDescriptor {
        if (kind == Kind.ONE_TO_MANY && direction != Direction.INVERSE) {
            throw new SchemaException("One-to-many relationship " + name + " must be inverse");
        }
        field.setAccessible(true);
    }

    public boolean isCollection() {
        return kind == Kind.ONE_TO_MANY;
    }

    /**
     * Whether the foreign key lives on the owning model's table.
     */
    public boolean isForward() {
        return direction == Direction.FORWARD;
    }

    public Object get(Object owner) {
        try {
            return field.get(owner);
        } catch (IllegalAccessException e) {
            throw new SchemaException("Cannot access relationship " + name, e);
        }
    }

    public void set(Object owner, Object value) {
        try {
            field.set(owner, value);
        } catch (IllegalAccessException e) {
            throw new SchemaException("Cannot set relationship " + name, e);
        }
    }

    public enum Kind {
        ONE_TO_ONE, ONE_TO_MANY
    }

    public enum Direction {
        /** The owning table stores the foreign key. */
        FORWARD,
        /** The related table stores the foreign key. */
        INVERSE
    }
}
