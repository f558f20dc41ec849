package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Embeds the field's object into the owning table: its {@link Column}-mapped
 * fields become columns of the owner. The embedded type needs a parameterless
 * constructor.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Inline {
}
