package de.t14d3.spindle.core;

import de.t14d3.spindle.exceptions.NoRowsException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Lazy, forward-only view of the records a query produces. Not thread safe.
 * <pre>{@code
 * try (RecordSet<Person> people = store.find(query)) {
 *     while (people.next()) {
 *         Person person = people.get();
 *     }
 * }
 * }</pre>
 * The underlying cursor is released once the set is exhausted or closed; after
 * that {@link #next()} returns {@code false} and {@link #get()} fails with
 * {@link de.t14d3.spindle.exceptions.ResultSetClosedException}.
 *
 * @param <T> the record type
 */
public interface RecordSet<T extends Record> extends AutoCloseable {

    /**
     * Move to the next record.
     *
     * @return {@code false} when there is none; the set is closed at that point
     */
    boolean next();

    /**
     * The current record.
     *
     * @throws de.t14d3.spindle.exceptions.ResultSetClosedException when the set is closed
     * @throws IllegalStateException                                 before the first {@link #next()}
     */
    T get();

    /**
     * Release the cursor. Safe to call repeatedly and after exhaustion.
     */
    @Override
    void close();

    /**
     * Drain the remaining records into a list.
     */
    default List<T> all() {
        List<T> records = new ArrayList<>();
        try {
            while (next()) {
                records.add(get());
            }
        } finally {
            close();
        }
        return records;
    }

    /**
     * The next record; the set is closed afterwards.
     *
     * @throws NoRowsException when there is none
     */
    default T one() {
        try {
            if (!next()) {
                throw new NoRowsException("Query returned no rows");
            }
            return get();
        } finally {
            close();
        }
    }

    default void forEach(Consumer<? super T> action) {
        try {
            while (next()) {
                action.accept(get());
            }
        } finally {
            close();
        }
    }
}
