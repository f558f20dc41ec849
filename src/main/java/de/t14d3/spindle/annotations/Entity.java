package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a record type that maps to one table.
 * <p>
 * Annotated classes are picked up by {@link de.t14d3.spindle.mapping.Schema#scan(String...)}
 * or registered explicitly with {@link de.t14d3.spindle.mapping.Schema.Builder#register(Class[])}.
 * The class must extend {@link de.t14d3.spindle.core.Model} and declare a parameterless
 * constructor.
 *
 * @see Table
 * @see Column
 * @see Id
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
}
