package de.t14d3.spindle.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Factory methods for building {@link Condition} trees.
 * <pre>{@code
 * Condition c = and(eq("name", "Alice"), or(gt("age", 30), isNull("email")));
 * }</pre>
 */
public final class Conditions {
    private Conditions() {
    }

    public static Condition eq(String column, Object value) {
        return value == null ? isNull(column) : new Comparison(column, Comparison.Operator.EQ, value);
    }

    public static Condition neq(String column, Object value) {
        return value == null ? isNotNull(column) : new Comparison(column, Comparison.Operator.NEQ, value);
    }

    public static Condition lt(String column, Object value) {
        return new Comparison(column, Comparison.Operator.LT, value);
    }

    public static Condition lte(String column, Object value) {
        return new Comparison(column, Comparison.Operator.LTE, value);
    }

    public static Condition gt(String column, Object value) {
        return new Comparison(column, Comparison.Operator.GT, value);
    }

    public static Condition gte(String column, Object value) {
        return new Comparison(column, Comparison.Operator.GTE, value);
    }

    public static Condition like(String column, String pattern) {
        return new Comparison(column, Comparison.Operator.LIKE, pattern);
    }

    /**
     * Case-insensitive pattern match.
     */
    public static Condition ilike(String column, String pattern) {
        return new Comparison(column, Comparison.Operator.ILIKE, pattern);
    }

    public static Condition in(String column, Object... values) {
        return new InCondition(column, Arrays.asList(values), false);
    }

    public static Condition in(String column, Collection<?> values) {
        return new InCondition(column, new ArrayList<>(values), false);
    }

    public static Condition notIn(String column, Object... values) {
        return new InCondition(column, Arrays.asList(values), true);
    }

    public static Condition notIn(String column, Collection<?> values) {
        return new InCondition(column, new ArrayList<>(values), true);
    }

    public static Condition isNull(String column) {
        return new NullCondition(column, false);
    }

    public static Condition isNotNull(String column) {
        return new NullCondition(column, true);
    }

    public static Condition and(Condition... conditions) {
        return junction(Junction.Type.AND, conditions);
    }

    public static Condition or(Condition... conditions) {
        return junction(Junction.Type.OR, conditions);
    }

    public static Condition not(Condition condition) {
        return new Negation(condition);
    }

    public static Condition jsonHasKey(String column, String key) {
        return new JsonCondition(column, JsonCondition.Operator.HAS_KEY, List.of(key), null);
    }

    public static Condition jsonHasAnyKey(String column, String... keys) {
        return new JsonCondition(column, JsonCondition.Operator.HAS_ANY_KEY, Arrays.asList(keys), null);
    }

    public static Condition jsonHasAllKeys(String column, String... keys) {
        return new JsonCondition(column, JsonCondition.Operator.HAS_ALL_KEYS, Arrays.asList(keys), null);
    }

    /**
     * The stored document contains {@code document} (encoded as JSON when rendered).
     */
    public static Condition jsonContains(String column, Object document) {
        return new JsonCondition(column, JsonCondition.Operator.CONTAINS, List.of(), document);
    }

    public static Condition jsonContainedBy(String column, Object document) {
        return new JsonCondition(column, JsonCondition.Operator.CONTAINED_BY, List.of(), document);
    }

    public static Condition jsonPathExists(String column, String... path) {
        if (path.length == 0) {
            throw new IllegalArgumentException("path must not be empty");
        }
        return new JsonCondition(column, JsonCondition.Operator.PATH_EXISTS, Arrays.asList(path), null);
    }

    public static Condition arrayContains(String column, Object... values) {
        return new ArrayCondition(column, ArrayCondition.Operator.CONTAINS, Arrays.asList(values));
    }

    public static Condition arrayContainedBy(String column, Object... values) {
        return new ArrayCondition(column, ArrayCondition.Operator.CONTAINED_BY, Arrays.asList(values));
    }

    public static Condition arrayOverlaps(String column, Object... values) {
        return new ArrayCondition(column, ArrayCondition.Operator.OVERLAPS, Arrays.asList(values));
    }

    // nested junctions of the same type are flattened
    private static Condition junction(Junction.Type type, Condition... conditions) {
        List<Condition> flat = new ArrayList<>();
        for (Condition condition : conditions) {
            if (condition == null) {
                continue;
            }
            if (condition instanceof Junction junction && junction.type() == type) {
                flat.addAll(junction.children());
            } else {
                flat.add(condition);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException(type + " requires at least one condition");
        }
        return flat.size() == 1 ? flat.get(0) : new Junction(type, flat);
    }
}
