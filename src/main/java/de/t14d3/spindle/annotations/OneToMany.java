package de.t14d3.spindle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies a one-to-many relationship.
 * <p>
 * The annotated field must be a {@link java.util.List} of the target entity. The
 * foreign key always lives on the target's table (default column:
 * {@code <this entity>_id}).
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface OneToMany {
    /**
     * The entity class on the many side.
     */
    Class<?> targetEntity();
}
