package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.RowCursor;
import de.t14d3.spindle.connection.SqlExecutor;
import de.t14d3.spindle.connection.TransactionalExecutor;
import de.t14d3.spindle.exceptions.NoRowsException;
import de.t14d3.spindle.exceptions.NotPersistedException;
import de.t14d3.spindle.exceptions.TransactionException;
import de.t14d3.spindle.hooks.Hooks;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.PrimaryKeyDescriptor;
import de.t14d3.spindle.mapping.RelationshipDescriptor;
import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.query.Conditions;
import de.t14d3.spindle.query.Inclusion;
import de.t14d3.spindle.query.Query;
import de.t14d3.spindle.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Entry point for reading and writing records of one type.
 * <p>
 * Writes follow a fixed sequence: validation, {@code beforeSave}, {@code beforeInsert}
 * or {@code beforeUpdate}, the statement, {@code afterInsert} or {@code afterUpdate},
 * {@code afterSave}. A write runs inside a transaction when the record implements an
 * After* hook or carries related records to save, so a late failure rolls
 * everything back. A store bound to a transaction reuses it instead of nesting.
 *
 * @param <T> the record type
 */
public class Store<T extends Record> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Store.class);

    private final Schema schema;
    private final ModelDescriptor<T> model;
    private final SqlExecutor executor;
    private final int batchSize;
    private final WriteJournal journal;
    private final Persister persister;

    public Store(Schema schema, Class<T> type, SqlExecutor executor) {
        this(schema, schema.descriptor(type), executor, Query.DEFAULT_BATCH_SIZE, null);
    }

    public Store(Schema schema, Class<T> type, SqlExecutor executor, int batchSize) {
        this(schema, schema.descriptor(type), executor, batchSize, null);
    }

    private Store(Schema schema, ModelDescriptor<T> model, SqlExecutor executor, int batchSize, WriteJournal journal) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.schema = schema;
        this.model = model;
        this.executor = executor;
        this.batchSize = batchSize;
        this.journal = journal;
        this.persister = new Persister(executor, schema, journal);
    }

    public ModelDescriptor<T> getModel() {
        return model;
    }

    public Schema getSchema() {
        return schema;
    }

    public SqlExecutor getExecutor() {
        return executor;
    }

    /**
     * A store for another record type sharing this store's executor and, when
     * bound to one, its transaction.
     */
    public <U extends Record> Store<U> storeFor(Class<U> type) {
        return new Store<>(schema, schema.descriptor(type), executor, batchSize, journal);
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    /**
     * A new, unrestricted query for this store's type.
     */
    public Query<T> query() {
        return Query.of(model, batchSize);
    }

    /**
     * Run a query. The caller must drain or close the returned set.
     */
    public RecordSet<T> find(Query<T> query) {
        requireOwnQuery(query);
        SelectPlan<T> plan = new SelectPlan<>(query, schema, executor.dialect());
        BaseRecordSet<T> base = new BaseRecordSet<>(plan, executor.query(plan.statement()));

        List<Inclusion> collections = new ArrayList<>();
        for (Inclusion inclusion : query.getInclusions()) {
            if (inclusion.relationship().isCollection()) {
                collections.add(inclusion);
            }
        }
        if (collections.isEmpty()) {
            return base;
        }
        return new BatchingRecordSet<>(base, query, collections, new RelationshipLoader(executor, schema));
    }

    public List<T> findAll(Query<T> query) {
        return find(query).all();
    }

    public List<T> findAll() {
        return findAll(query());
    }

    /**
     * The first record matching the query.
     *
     * @throws NoRowsException when nothing matches
     */
    public T findOne(Query<T> query) {
        Query<T> limited = query.getLimit() == null ? query.limit(1) : query;
        return find(limited).one();
    }

    /**
     * The record with the given primary key, or {@code null}.
     */
    public T findById(Object id) {
        try (RecordSet<T> records = find(query().where(Conditions.eq(model.getPrimaryKey().column(), id)))) {
            return records.next() ? records.get() : null;
        }
    }

    public long count(Query<T> query) {
        requireOwnQuery(query);
        Statement statement = Statement.select(executor.dialect())
                .from(model.getTable(), SelectPlan.ROOT_ALIAS)
                .count()
                .where(query.getCondition())
                .build();
        try (RowCursor cursor = executor.query(statement)) {
            cursor.next();
            return ((Number) cursor.get(0)).longValue();
        }
    }

    public long count() {
        return count(query());
    }

    private void requireOwnQuery(Query<T> query) {
        if (query.getModel() != model) {
            throw new IllegalArgumentException("Query for " + query.getModel().getType().getName()
                    + " cannot run on a store for " + model.getType().getName());
        }
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    /**
     * Insert a new record together with the records in its relationship slots.
     *
     * @throws de.t14d3.spindle.exceptions.PreconditionException when the record is already
     *         persisted or its non-generated key is unset
     * @throws de.t14d3.spindle.exceptions.NotWritableException  when the record is not writable
     */
    public void insert(T record) {
        Persister.validateInsert(model, record);
        write(record, p -> {
            p.insert(model, record, true);
            return null;
        });
    }

    /**
     * Update a persisted record, optionally restricted to some columns.
     *
     * @return the affected row count; 0 when no row has the record's key
     * @throws NotPersistedException when the record was never saved
     */
    public int update(T record, String... columns) {
        Persister.validateUpdate(model, record);
        List<String> targets = Arrays.asList(columns);
        for (String column : targets) {
            if (column.equals(model.getPrimaryKey().column())) {
                throw new IllegalArgumentException("The primary key " + column + " cannot be updated");
            }
            if (!model.hasColumn(column) && !model.getForeignKeyColumns().contains(column)) {
                throw new IllegalArgumentException("Unknown column " + column + " on " + model.getTable());
            }
        }
        return write(record, p -> p.update(model, record, targets, true));
    }

    /**
     * Insert the record if it was never persisted, update it otherwise.
     */
    public SaveResult save(T record) {
        if (record.isPersisted()) {
            update(record);
            return SaveResult.UPDATED;
        }
        insert(record);
        return SaveResult.INSERTED;
    }

    /**
     * Delete the record's row. Related records are left alone.
     *
     * @return the affected row count
     * @throws NotPersistedException when the record was never saved
     */
    public int delete(T record) {
        if (!record.isPersisted()) {
            throw new NotPersistedException(model.getType());
        }
        if (Hooks.hasAfterHooks(record)) {
            LOGGER.debug("Promoting delete of {} to a transaction", model.getType().getSimpleName());
            return computeInTransaction(store -> store.persister.delete(model, record));
        }
        return persister.delete(model, record);
    }

    /**
     * Delete related records of an inverse relationship. The given records go
     * through the full delete protocol in one transaction; an empty list deletes
     * every related row of {@code parent} with a single statement. The parent's
     * relationship slot is updated to match.
     */
    public void removeRelated(T parent, String relationshipName, List<? extends Record> related) {
        RelationshipDescriptor relationship = model.getRelationship(relationshipName);
        if (relationship.isForward()) {
            throw new IllegalArgumentException("Relationship " + relationshipName
                    + " stores its key on " + model.getTable() + "; clear the slot and update instead");
        }
        if (!parent.isPersisted()) {
            throw new NotPersistedException(model.getType());
        }
        ModelDescriptor<? extends Record> target = schema.target(relationship);
        PrimaryKeyDescriptor pk = model.getPrimaryKey();

        if (related.isEmpty()) {
            int count = persister.deleteWhere(target, Conditions.eq(relationship.foreignKey(), pk.get(parent)));
            LOGGER.debug("Removed {} {} records from {}", count, target.getType().getSimpleName(), relationshipName);
            for (Record removed : slotContents(relationship, parent)) {
                removed.recordState().setPersisted(false);
            }
            relationship.set(parent, relationship.isCollection() ? new ArrayList<>() : null);
            return;
        }

        transactional(store -> {
            for (Record record : related) {
                if (!record.isPersisted()) {
                    throw new NotPersistedException(target.getType());
                }
                store.persister.delete(target, record);
            }
        });

        Set<Record> removed = Collections.newSetFromMap(new IdentityHashMap<>());
        removed.addAll(related);
        if (relationship.isCollection()) {
            List<Record> remaining = new ArrayList<>();
            for (Record record : slotContents(relationship, parent)) {
                if (!removed.contains(record)) {
                    remaining.add(record);
                }
            }
            relationship.set(parent, remaining);
        } else if (removed.contains(relationship.get(parent))) {
            relationship.set(parent, null);
        }
    }

    private static List<Record> slotContents(RelationshipDescriptor relationship, Record owner) {
        Object value = relationship.get(owner);
        List<Record> contents = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                contents.add((Record) item);
            }
        } else if (value != null) {
            contents.add((Record) value);
        }
        return contents;
    }

    /**
     * Re-read every column of the record, discarding local changes. The record is
     * writable afterwards; relationship slots are not touched.
     *
     * @throws NotPersistedException when the record was never saved
     * @throws NoRowsException       when its row no longer exists
     */
    public void reload(T record) {
        if (!record.isPersisted()) {
            throw new NotPersistedException(model.getType());
        }
        PrimaryKeyDescriptor pk = model.getPrimaryKey();
        Query<T> query = query().where(Conditions.eq(pk.column(), pk.get(record)));
        SelectPlan<T> plan = new SelectPlan<>(query, schema, executor.dialect());
        List<String> columns = new ArrayList<>(model.getColumnNames());
        columns.addAll(model.getForeignKeyColumns());
        try (RowCursor cursor = executor.query(plan.statement())) {
            if (!cursor.next()) {
                throw new NoRowsException("No " + model.getTable() + " row with " + pk.column() + " = " + pk.get(record));
            }
            RowDecoder.populate(model, columns, cursor, 0, record);
        }
        record.recordState().setWritable(true);
    }

    private <R> R write(T record, Function<Persister, R> operation) {
        boolean hooks = Hooks.hasAfterHooks(record);
        boolean related = Persister.hasRelated(model, record);
        if (!hooks && !related) {
            return operation.apply(persister);
        }
        LOGGER.debug("Promoting write of {} to a transaction (after hooks: {}, related records: {})",
                model.getType().getSimpleName(), hooks, related);
        return computeInTransaction(store -> operation.apply(store.persister));
    }

    // ---------------------------------------------------------------------
    // Transactions
    // ---------------------------------------------------------------------

    public void transactional(Consumer<Store<T>> work) {
        computeInTransaction(store -> {
            work.accept(store);
            return null;
        });
    }

    /**
     * Run {@code work} with a store bound to one transaction and commit afterwards.
     * When this store is already bound to a transaction, that transaction is reused
     * and left for its owner to complete. Any failure rolls the transaction back
     * and restores the in-memory state of the records written in it.
     */
    public <R> R computeInTransaction(Function<Store<T>, R> work) {
        if (executor.inTransaction()) {
            return work.apply(this);
        }
        TransactionalExecutor transaction = executor.beginTransaction();
        WriteJournal transactionJournal = new WriteJournal();
        Store<T> bound = new Store<>(schema, model, transaction, batchSize, transactionJournal);

        R result;
        try {
            result = work.apply(bound);
        } catch (RuntimeException | Error e) {
            rollback(transaction, transactionJournal, e);
            throw e;
        }
        try {
            transaction.commit();
        } catch (TransactionException e) {
            transactionJournal.restore();
            throw e;
        }
        return result;
    }

    private static void rollback(TransactionalExecutor transaction, WriteJournal journal, Throwable cause) {
        journal.restore();
        try {
            transaction.rollback();
        } catch (TransactionException e) {
            LOGGER.warn("Rollback failed after {}", cause.toString(), e);
            cause.addSuppressed(e);
        } catch (RuntimeException e) {
            LOGGER.warn("Rollback failed after {}", cause.toString(), e);
            cause.addSuppressed(new TransactionException("Failed to roll back transaction", e));
        }
    }
}
