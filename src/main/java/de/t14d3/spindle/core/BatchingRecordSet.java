package de.t14d3.spindle.core;

import de.t14d3.spindle.exceptions.ResultSetClosedException;
import de.t14d3.spindle.query.Inclusion;
import de.t14d3.spindle.query.Query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Record set that reads parents a page at a time and loads their one-to-many
 * relationships with one query per page and relationship.
 */
class BatchingRecordSet<T extends Record> implements RecordSet<T> {
    private final BaseRecordSet<T> parents;
    private final Query<T> query;
    private final List<Inclusion> inclusions;
    private final RelationshipLoader loader;
    private final Deque<T> buffer = new ArrayDeque<>();
    private T current;
    private boolean closed;

    BatchingRecordSet(BaseRecordSet<T> parents, Query<T> query, List<Inclusion> inclusions, RelationshipLoader loader) {
        this.parents = parents;
        this.query = query;
        this.inclusions = inclusions;
        this.loader = loader;
    }

    @Override
    public boolean next() {
        if (closed) {
            return false;
        }
        if (buffer.isEmpty()) {
            fill();
        }
        current = buffer.poll();
        if (current == null) {
            close();
            return false;
        }
        return true;
    }

    private void fill() {
        List<T> page = new ArrayList<>(query.getBatchSize());
        while (page.size() < query.getBatchSize() && parents.next()) {
            page.add(parents.get());
        }
        for (Inclusion inclusion : inclusions) {
            loader.load(query.getModel(), page, inclusion);
        }
        buffer.addAll(page);
    }

    @Override
    public T get() {
        if (closed) {
            throw new ResultSetClosedException();
        }
        if (current == null) {
            throw new IllegalStateException("next() must be called before get()");
        }
        return current;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            current = null;
            buffer.clear();
            parents.close();
        }
    }
}
