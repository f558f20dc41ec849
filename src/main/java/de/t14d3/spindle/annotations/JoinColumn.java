package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes the foreign key column of a {@link OneToOne} or {@link OneToMany}
 * relationship. The column lives on the owning table for forward relationships
 * and on the related table for inverse ones.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface JoinColumn {
    String name();
}
