package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.SqlExecutor;
import de.t14d3.spindle.exceptions.NotPersistedException;
import de.t14d3.spindle.exceptions.NotWritableException;
import de.t14d3.spindle.exceptions.PreconditionException;
import de.t14d3.spindle.exceptions.SpindleException;
import de.t14d3.spindle.hooks.Hooks;
import de.t14d3.spindle.mapping.FieldDescriptor;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.PrimaryKeyDescriptor;
import de.t14d3.spindle.mapping.RelationshipDescriptor;
import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.query.Condition;
import de.t14d3.spindle.query.Conditions;
import de.t14d3.spindle.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs the write protocol for single records: validation, hooks, the statement
 * itself and, when cascading, the records held in relationship slots.
 */
final class Persister {
    private static final Logger LOGGER = LoggerFactory.getLogger(Persister.class);

    private final SqlExecutor executor;
    private final Schema schema;
    private final WriteJournal journal;

    Persister(SqlExecutor executor, Schema schema, WriteJournal journal) {
        this.executor = executor;
        this.schema = schema;
        this.journal = journal;
    }

    static void validateInsert(ModelDescriptor<?> model, Record record) {
        if (record.isPersisted()) {
            throw new PreconditionException("Record of type " + model.getType().getName() + " is already persisted");
        }
        PrimaryKeyDescriptor pk = model.getPrimaryKey();
        if (!pk.autoIncrement() && pk.isEmpty(record)) {
            throw new PreconditionException("Primary key " + pk.column() + " of " + model.getType().getName()
                    + " must be set before insert");
        }
        if (!record.isWritable()) {
            throw new NotWritableException(model.getType());
        }
    }

    static void validateUpdate(ModelDescriptor<?> model, Record record) {
        if (!record.isPersisted()) {
            throw new NotPersistedException(model.getType());
        }
        PrimaryKeyDescriptor pk = model.getPrimaryKey();
        if (pk.isEmpty(record)) {
            throw new PreconditionException("Primary key " + pk.column() + " of " + model.getType().getName()
                    + " is not set");
        }
        if (!record.isWritable()) {
            throw new NotWritableException(model.getType());
        }
    }

    /**
     * Whether saving the record also has to save related records.
     */
    static boolean hasRelated(ModelDescriptor<?> model, Record record) {
        for (RelationshipDescriptor relationship : model.getRelationships()) {
            if (!related(relationship, record).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static List<Record> related(RelationshipDescriptor relationship, Record owner) {
        Object value = relationship.get(owner);
        List<Record> records = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null) {
                    records.add((Record) item);
                }
            }
        } else if (value != null) {
            records.add((Record) value);
        }
        return records;
    }

    boolean save(ModelDescriptor<?> model, Record record, boolean cascade) {
        if (record.isPersisted()) {
            validateUpdate(model, record);
            update(model, record, List.of(), cascade);
            return false;
        }
        validateInsert(model, record);
        insert(model, record, cascade);
        return true;
    }

    void insert(ModelDescriptor<?> model, Record record, boolean cascade) {
        track(model, record);
        Hooks.beforeSave(record);
        Hooks.beforeInsert(record);
        if (cascade) {
            saveForward(model, record);
        }

        PrimaryKeyDescriptor pk = model.getPrimaryKey();
        boolean generated = pk.autoIncrement() && pk.isEmpty(record);
        Statement.InsertBuilder insert = Statement.insertInto(executor.dialect(), model.getTable());
        for (FieldDescriptor column : model.getColumns()) {
            if (generated && column == pk.field()) {
                continue;
            }
            insert.value(column.getColumn(), RowDecoder.toColumn(column, column.get(record), executor.dialect()));
        }
        for (String column : model.getForeignKeyColumns()) {
            insert.value(column, record.recordState().getForeignKey(column));
        }

        Object key = executor.insert(insert.build(), generated ? pk.column() : null);
        if (generated) {
            if (key == null) {
                throw new SpindleException("No generated key returned for " + model.getTable());
            }
            pk.set(record, key);
        }
        record.recordState().setPersisted(true);

        if (cascade) {
            saveInverse(model, record);
        }
        Hooks.afterInsert(record);
        Hooks.afterSave(record);
    }

    /**
     * @param columns columns to write; empty writes every column
     * @return affected row count
     */
    int update(ModelDescriptor<?> model, Record record, List<String> columns, boolean cascade) {
        track(model, record);
        Hooks.beforeSave(record);
        Hooks.beforeUpdate(record);
        if (cascade) {
            saveForward(model, record);
        }

        PrimaryKeyDescriptor pk = model.getPrimaryKey();
        List<String> targets = columns.isEmpty() ? writableColumns(model) : columns;
        int count = 0;
        if (targets.isEmpty()) {
            LOGGER.debug("Nothing to update for {}", model.getType().getSimpleName());
        } else {
            Statement.UpdateBuilder update = Statement.update(executor.dialect(), model.getTable());
            for (String column : targets) {
                if (model.hasColumn(column)) {
                    FieldDescriptor field = model.getColumn(column);
                    update.set(column, RowDecoder.toColumn(field, field.get(record), executor.dialect()));
                } else {
                    update.set(column, record.recordState().getForeignKey(column));
                }
            }
            update.where(Conditions.eq(pk.column(), pk.get(record)));
            count = executor.update(update.build());
        }

        if (cascade) {
            saveInverse(model, record);
        }
        Hooks.afterUpdate(record);
        Hooks.afterSave(record);
        return count;
    }

    private static List<String> writableColumns(ModelDescriptor<?> model) {
        List<String> columns = new ArrayList<>();
        for (String column : model.getColumnNames()) {
            if (!column.equals(model.getPrimaryKey().column())) {
                columns.add(column);
            }
        }
        columns.addAll(model.getForeignKeyColumns());
        return columns;
    }

    int delete(ModelDescriptor<?> model, Record record) {
        track(model, record);
        Hooks.beforeDelete(record);
        PrimaryKeyDescriptor pk = model.getPrimaryKey();
        int count = executor.update(Statement.deleteFrom(executor.dialect(), model.getTable())
                .where(Conditions.eq(pk.column(), pk.get(record)))
                .build());
        record.recordState().setPersisted(false);
        Hooks.afterDelete(record);
        return count;
    }

    int deleteWhere(ModelDescriptor<?> model, Condition condition) {
        return executor.update(Statement.deleteFrom(executor.dialect(), model.getTable())
                .where(condition)
                .build());
    }

    // forward targets are saved first so the owner can store their key
    private void saveForward(ModelDescriptor<?> model, Record record) {
        for (RelationshipDescriptor relationship : model.getRelationships()) {
            if (!relationship.isForward()) {
                continue;
            }
            Object value = relationship.get(record);
            if (value == null) {
                continue;
            }
            Record related = (Record) value;
            ModelDescriptor<? extends Record> target = schema.target(relationship);
            save(target, related, false);
            model.setColumnValue(record, relationship.foreignKey(), target.getPrimaryKey().get(related));
        }
    }

    // inverse targets are saved last so they can store the owner's key
    private void saveInverse(ModelDescriptor<?> model, Record record) {
        Object key = model.getPrimaryKey().get(record);
        for (RelationshipDescriptor relationship : model.getRelationships()) {
            if (relationship.isForward()) {
                continue;
            }
            ModelDescriptor<? extends Record> target = schema.target(relationship);
            for (Record related : related(relationship, record)) {
                track(target, related);
                target.setColumnValue(related, relationship.foreignKey(), key);
                save(target, related, false);
            }
        }
    }

    private void track(ModelDescriptor<?> model, Record record) {
        if (journal != null) {
            journal.track(model, record);
        }
    }
}
