package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Stores the field as a JSON document in a JSON-typed column. The field's
 * declared (generic) type drives decoding.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Json {
    /**
     * The name of the database column. Defaults to the snake_case field name.
     */
    String name() default "";
}
