package de.t14d3.spindle.query;

import java.util.List;

/**
 * AND or OR over two or more children.
 */
public record Junction(Type type, List<Condition> children) implements Condition {
    public Junction {
        children = List.copyOf(children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("junction requires at least one condition");
        }
    }

    public enum Type {
        AND, OR
    }
}
