package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.RowCursor;
import de.t14d3.spindle.connection.SqlExecutor;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.PrimaryKeyDescriptor;
import de.t14d3.spindle.mapping.RelationshipDescriptor;
import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.mapping.TypeMapper;
import de.t14d3.spindle.query.Conditions;
import de.t14d3.spindle.query.Inclusion;
import de.t14d3.spindle.query.Order;
import de.t14d3.spindle.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads one-to-many relationships for a page of parents with a single query and
 * merges the children back by foreign key.
 */
final class RelationshipLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(RelationshipLoader.class);

    private final SqlExecutor executor;
    private final Schema schema;

    RelationshipLoader(SqlExecutor executor, Schema schema) {
        this.executor = executor;
        this.schema = schema;
    }

    /**
     * Fill {@code inclusion}'s slot on every parent. Parents without children get an
     * empty list.
     */
    <T extends Record> void load(ModelDescriptor<T> parentModel, List<T> parents, Inclusion inclusion) {
        if (parents.isEmpty()) {
            return;
        }
        RelationshipDescriptor relationship = inclusion.relationship();
        PrimaryKeyDescriptor parentKey = parentModel.getPrimaryKey();

        Set<Object> keys = new LinkedHashSet<>();
        for (T parent : parents) {
            keys.add(parentKey.get(parent));
        }

        Map<Object, List<Record>> children = fetch(schema.target(relationship), relationship, keys, inclusion, parentKey);

        for (T parent : parents) {
            List<Record> slot = children.get(parentKey.get(parent));
            relationship.set(parent, slot == null ? new ArrayList<>() : slot);
        }
    }

    private <C extends Record> Map<Object, List<Record>> fetch(ModelDescriptor<C> target,
                                                              RelationshipDescriptor relationship, Set<Object> keys,
                                                              Inclusion inclusion, PrimaryKeyDescriptor parentKey) {
        Query<C> query = Query.of(target)
                .where(Conditions.in(relationship.foreignKey(), keys))
                .order(Order.asc(target.getPrimaryKey().column()));
        if (inclusion.filter() != null) {
            query = query.where(inclusion.filter());
        }

        SelectPlan<C> plan = new SelectPlan<>(query, schema, executor.dialect());
        Map<Object, List<Record>> grouped = new HashMap<>();
        int count = 0;
        try (RowCursor cursor = executor.query(plan.statement())) {
            while (cursor.next()) {
                C child = plan.decode(cursor);
                Object owner = TypeMapper.convertToJavaType(
                        target.getColumnValue(child, relationship.foreignKey()), parentKey.javaType());
                grouped.computeIfAbsent(owner, k -> new ArrayList<>()).add(child);
                count++;
            }
        }
        LOGGER.debug("Loaded {} {} records for {} parents through {}", count,
                target.getType().getSimpleName(), keys.size(), relationship.name());
        return grouped;
    }
}
