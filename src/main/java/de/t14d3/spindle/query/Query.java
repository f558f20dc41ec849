package de.t14d3.spindle.query;

import de.t14d3.spindle.core.Record;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.RelationshipDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable query over one record type. Every builder method returns a new query
 * and leaves the receiver untouched, so a query can be shared and extended freely.
 * <pre>{@code
 * Query<Person> adults = store.query()
 *         .where(Conditions.gte("age", 18))
 *         .order(Order.asc("name"))
 *         .with("pets")
 *         .limit(20);
 * }</pre>
 *
 * @param <T> the record type
 */
public final class Query<T extends Record> {
    public static final int DEFAULT_BATCH_SIZE = 50;

    private final ModelDescriptor<T> model;
    private final Condition condition;
    private final Set<String> selected;
    private final Set<String> excluded;
    private final List<Order> orders;
    private final Integer limit;
    private final Integer offset;
    private final List<Inclusion> inclusions;
    private final int batchSize;

    private Query(ModelDescriptor<T> model, Condition condition, Set<String> selected, Set<String> excluded,
                  List<Order> orders, Integer limit, Integer offset, List<Inclusion> inclusions, int batchSize) {
        this.model = model;
        this.condition = condition;
        this.selected = selected == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(selected));
        this.excluded = excluded == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(excluded));
        this.orders = List.copyOf(orders);
        this.limit = limit;
        this.offset = offset;
        this.inclusions = List.copyOf(inclusions);
        this.batchSize = batchSize;
    }

    public static <T extends Record> Query<T> of(ModelDescriptor<T> model) {
        return of(model, DEFAULT_BATCH_SIZE);
    }

    public static <T extends Record> Query<T> of(ModelDescriptor<T> model, int batchSize) {
        return new Query<>(model, null, null, null, List.of(), null, null, List.of(), batchSize);
    }

    /**
     * Restrict the result; repeated calls combine with AND.
     */
    public Query<T> where(Condition condition) {
        if (condition == null) {
            throw new IllegalArgumentException("condition must not be null");
        }
        Condition combined = this.condition == null ? condition : Conditions.and(this.condition, condition);
        return new Query<>(model, combined, selected, excluded, orders, limit, offset, inclusions, batchSize);
    }

    /**
     * Append orderings, applied after the ones already present.
     */
    public Query<T> order(Order... orders) {
        List<Order> combined = new ArrayList<>(this.orders);
        for (Order order : orders) {
            requireKnownColumn(order.column());
            combined.add(order);
        }
        return new Query<>(model, condition, selected, excluded, combined, limit, offset, inclusions, batchSize);
    }

    public Query<T> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return new Query<>(model, condition, selected, excluded, orders, limit, offset, inclusions, batchSize);
    }

    public Query<T> offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return new Query<>(model, condition, selected, excluded, orders, limit, offset, inclusions, batchSize);
    }

    /**
     * Load only the given columns (plus the primary key). Records loaded through a
     * strict subset are not writable.
     *
     * @throws IllegalArgumentException for unknown columns
     * @throws IllegalStateException    when {@link #selectNot} was used
     */
    public Query<T> select(String... columns) {
        if (excluded != null) {
            throw new IllegalStateException("select and selectNot are mutually exclusive");
        }
        Set<String> set = new LinkedHashSet<>();
        for (String column : columns) {
            model.getColumn(column);
            set.add(column);
        }
        return new Query<>(model, condition, set, null, orders, limit, offset, inclusions, batchSize);
    }

    /**
     * Load every column except the given ones.
     *
     * @throws IllegalArgumentException for unknown columns or the primary key
     * @throws IllegalStateException    when {@link #select} was used
     */
    public Query<T> selectNot(String... columns) {
        if (selected != null) {
            throw new IllegalStateException("select and selectNot are mutually exclusive");
        }
        Set<String> set = new LinkedHashSet<>();
        for (String column : columns) {
            model.getColumn(column);
            if (column.equals(model.getPrimaryKey().column())) {
                throw new IllegalArgumentException("The primary key " + column + " cannot be excluded");
            }
            set.add(column);
        }
        return new Query<>(model, condition, null, set, orders, limit, offset, inclusions, batchSize);
    }

    /**
     * Load a relationship together with the records.
     */
    public Query<T> with(String relationship) {
        return with(relationship, null);
    }

    /**
     * Load a relationship restricted by {@code filter}. A non-null filter makes the
     * loaded parents non-writable since their relationship may be incomplete.
     */
    public Query<T> with(String relationship, Condition filter) {
        RelationshipDescriptor descriptor = model.getRelationship(relationship);
        List<Inclusion> combined = new ArrayList<>();
        for (Inclusion inclusion : inclusions) {
            if (!inclusion.relationship().name().equals(relationship)) {
                combined.add(inclusion);
            }
        }
        combined.add(new Inclusion(descriptor, filter));
        return new Query<>(model, condition, selected, excluded, orders, limit, offset, combined, batchSize);
    }

    /**
     * Number of parents whose one-to-many relationships are loaded per query.
     */
    public Query<T> batchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        return new Query<>(model, condition, selected, excluded, orders, limit, offset, inclusions, batchSize);
    }

    /**
     * An independent clone. Queries are immutable, so this only exists for callers
     * that want an explicit copy to hand out.
     */
    public Query<T> copy() {
        return new Query<>(model, condition, selected, excluded, orders, limit, offset, inclusions, batchSize);
    }

    public ModelDescriptor<T> getModel() {
        return model;
    }

    /**
     * The combined condition, or {@code null} when unrestricted.
     */
    public Condition getCondition() {
        return condition;
    }

    public Set<String> getSelected() {
        return selected == null ? Set.of() : selected;
    }

    public Set<String> getExcluded() {
        return excluded == null ? Set.of() : excluded;
    }

    public List<Order> getOrders() {
        return orders;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public List<Inclusion> getInclusions() {
        return inclusions;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Mapped columns this query loads, in declaration order. The primary key is
     * always included.
     */
    public List<String> getProjection() {
        List<String> projection = new ArrayList<>();
        String pk = model.getPrimaryKey().column();
        for (String column : model.getColumnNames()) {
            boolean include;
            if (selected != null) {
                include = selected.contains(column) || column.equals(pk);
            } else if (excluded != null) {
                include = !excluded.contains(column);
            } else {
                include = true;
            }
            if (include) {
                projection.add(column);
            }
        }
        return projection;
    }

    /**
     * Whether the projection leaves out mapped columns.
     */
    public boolean isPartial() {
        return getProjection().size() < model.getColumnNames().size();
    }

    /**
     * Whether records loaded by this query can be written back.
     */
    public boolean isWritable() {
        if (isPartial()) {
            return false;
        }
        for (Inclusion inclusion : inclusions) {
            if (inclusion.isFiltered()) {
                return false;
            }
        }
        return true;
    }

    private void requireKnownColumn(String column) {
        if (!model.hasColumn(column) && !model.getForeignKeyColumns().contains(column)) {
            throw new IllegalArgumentException("Unknown column " + column + " on " + model.getTable());
        }
    }

    @Override
    public String toString() {
        return "Query{" + model.getType().getSimpleName()
                + ", where=" + condition
                + ", select=" + (selected != null ? selected : "*")
                + (excluded != null ? ", except=" + excluded : "")
                + ", order=" + orders
                + ", limit=" + limit
                + ", offset=" + offset
                + ", with=" + inclusions.stream().map(i -> i.relationship().name()).toList()
                + ", batchSize=" + batchSize + '}';
    }
}
