package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a field to a column.
 * <p>
 * If no name is given, the snake_case form of the field name is used. Fields of
 * array or {@link java.util.Collection} type are stored in a native array column;
 * use {@link Json} to store a value as a JSON document instead.
 *
 * @see Entity
 * @see Id
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /**
     * The name of the database column.
     */
    String name() default "";

    /**
     * Whether the column can be null.
     */
    boolean nullable() default true;
}
