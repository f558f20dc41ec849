package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.RowCursor;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.RelationshipDescriptor;
import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.query.Inclusion;
import de.t14d3.spindle.query.Order;
import de.t14d3.spindle.query.Query;
import de.t14d3.spindle.sql.Dialect;
import de.t14d3.spindle.sql.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * The SELECT a query runs and how its rows map back to records. One-to-one
 * inclusions are fetched through a LEFT JOIN so they cost no extra query; their
 * columns follow the parent's columns in each row.
 */
final class SelectPlan<T extends Record> {
    static final String ROOT_ALIAS = "t0";

    private final Query<T> query;
    private final List<String> columns;
    private final List<Join> joins = new ArrayList<>();
    private final Statement statement;

    SelectPlan(Query<T> query, Schema schema, Dialect dialect) {
        this.query = query;
        ModelDescriptor<T> model = query.getModel();
        this.columns = withForeignKeys(model, query.getProjection());

        Statement.SelectBuilder select = Statement.select(dialect)
                .from(model.getTable(), ROOT_ALIAS)
                .columns(ROOT_ALIAS, columns);

        int offset = columns.size();
        for (Inclusion inclusion : query.getInclusions()) {
            RelationshipDescriptor relationship = inclusion.relationship();
            if (relationship.isCollection()) {
                continue;
            }
            ModelDescriptor<? extends Record> target = schema.target(relationship);
            String alias = "r" + (joins.size() + 1);
            List<String> targetColumns = withForeignKeys(target, target.getColumnNames());
            String targetPk = target.getPrimaryKey().column();
            if (relationship.isForward()) {
                select.leftJoin(target.getTable(), alias, targetPk, ROOT_ALIAS, relationship.foreignKey(), inclusion.filter());
            } else {
                select.leftJoin(target.getTable(), alias, relationship.foreignKey(), ROOT_ALIAS,
                        model.getPrimaryKey().column(), inclusion.filter());
            }
            select.columns(alias, targetColumns);
            joins.add(new Join(relationship, target, targetColumns, offset, targetColumns.indexOf(targetPk)));
            offset += targetColumns.size();
        }

        select.where(query.getCondition());
        for (Order order : query.getOrders()) {
            select.orderBy(order.column(), order.descending());
        }
        select.limit(query.getLimit()).offset(query.getOffset());
        this.statement = select.build();
    }

    private static List<String> withForeignKeys(ModelDescriptor<?> model, List<String> projection) {
        List<String> all = new ArrayList<>(projection);
        all.addAll(model.getForeignKeyColumns());
        return all;
    }

    Statement statement() {
        return statement;
    }

    Query<T> query() {
        return query;
    }

    /**
     * Decode the cursor's current row into a new record, one-to-one inclusions included.
     */
    T decode(RowCursor cursor) {
        T record = RowDecoder.decode(query.getModel(), columns, cursor, 0, query.isWritable());
        for (Join join : joins) {
            Object related = null;
            if (cursor.get(join.offset() + join.keyIndex()) != null) {
                related = RowDecoder.decode(join.target(), join.columns(), cursor, join.offset(), true);
            }
            join.relationship().set(record, related);
        }
        return record;
    }

    private record Join(RelationshipDescriptor relationship, ModelDescriptor<? extends Record> target,
                        List<String> columns, int offset, int keyIndex) {}
}
