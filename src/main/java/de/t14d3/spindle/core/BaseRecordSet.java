package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.RowCursor;
import de.t14d3.spindle.exceptions.ResultSetClosedException;

/**
 * Record set reading straight from a cursor. Each {@link #get()} decodes the
 * current row into a new record.
 */
class BaseRecordSet<T extends Record> implements RecordSet<T> {
    private final SelectPlan<T> plan;
    private final RowCursor cursor;
    private boolean positioned;
    private boolean closed;

    BaseRecordSet(SelectPlan<T> plan, RowCursor cursor) {
        this.plan = plan;
        this.cursor = cursor;
    }

    @Override
    public boolean next() {
        if (closed) {
            return false;
        }
        if (cursor.next()) {
            positioned = true;
            return true;
        }
        close();
        return false;
    }

    @Override
    public T get() {
        if (closed) {
            throw new ResultSetClosedException();
        }
        if (!positioned) {
            throw new IllegalStateException("next() must be called before get()");
        }
        return plan.decode(cursor);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cursor.close();
        }
    }
}
