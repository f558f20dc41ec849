package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies a one-to-one relationship. The target type is the field type.
 * <p>
 * A forward relationship stores the foreign key on this entity's table
 * (default column: {@code <target>_id}). An inverse relationship stores it on the
 * target's table (default column: {@code <this entity>_id}); the target needs no
 * field for it.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface OneToOne {
    /**
     * Whether the foreign key lives on the target's table.
     */
    boolean inverse() default false;
}
