package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the primary key field. Every model has exactly one; it is always part of
 * a query's projection.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Id {
    /**
     * Whether the database generates the key on insert. A non-generated key must be
     * set before the record is inserted.
     */
    boolean autoIncrement() default false;
}
