package de.t14d3.spindle.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-instance state tracked by the engine: whether a row exists for the record,
 * whether its in-memory state is known to be complete, and the values of
 * foreign key columns that no field maps.
 */
public class RecordState {
    private boolean persisted;
    private boolean writable = true;
    private final Map<String, Object> foreignKeys = new LinkedHashMap<>();

    public boolean isPersisted() {
        return persisted;
    }

    public boolean isWritable() {
        return writable;
    }

    void setPersisted(boolean persisted) {
        this.persisted = persisted;
    }

    void setWritable(boolean writable) {
        this.writable = writable;
    }

    public boolean hasForeignKey(String column) {
        return foreignKeys.containsKey(column);
    }

    public Object getForeignKey(String column) {
        return foreignKeys.get(column);
    }

    public void setForeignKey(String column, Object value) {
        foreignKeys.put(column, value);
    }

    public Map<String, Object> getForeignKeys() {
        return Collections.unmodifiableMap(foreignKeys);
    }

    Snapshot snapshot() {
        return new Snapshot(persisted, writable, new LinkedHashMap<>(foreignKeys));
    }

    void restore(Snapshot snapshot) {
        this.persisted = snapshot.persisted();
        this.writable = snapshot.writable();
        this.foreignKeys.clear();
        this.foreignKeys.putAll(snapshot.foreignKeys());
    }

    record Snapshot(boolean persisted, boolean writable, Map<String, Object> foreignKeys) {}
}
