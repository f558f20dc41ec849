package de.t14d3.spindle.query;

import de.t14d3.spindle.mapping.RelationshipDescriptor;

import java.util.Objects;

/**
 * Directive to load a relationship together with the parent records.
 *
 * @param relationship the relationship to load
 * @param filter       restricts the related records; {@code null} loads all of them
 */
public record Inclusion(RelationshipDescriptor relationship, Condition filter) {
    public Inclusion {
        Objects.requireNonNull(relationship, "relationship");
    }

    public boolean isFiltered() {
        return filter != null;
    }
}
