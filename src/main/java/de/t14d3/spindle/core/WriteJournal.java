package de.t14d3.spindle.core;

import de.t14d3.spindle.mapping.FieldDescriptor;
import de.t14d3.spindle.mapping.ModelDescriptor;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Remembers the in-memory state of every record a transaction writes so it can be
 * put back when the transaction rolls back. Only the first state seen per
 * instance is kept.
 */
final class WriteJournal {
    private final Map<Record, Entry> entries = new IdentityHashMap<>();

    void track(ModelDescriptor<?> model, Record record) {
        if (entries.containsKey(record)) {
            return;
        }
        List<Object> values = new ArrayList<>();
        for (FieldDescriptor column : model.getColumns()) {
            values.add(column.get(record));
        }
        entries.put(record, new Entry(model, record.recordState().snapshot(), values));
    }

    void restore() {
        for (Map.Entry<Record, Entry> e : entries.entrySet()) {
            Record record = e.getKey();
            Entry entry = e.getValue();
            List<FieldDescriptor> columns = entry.model().getColumns();
            for (int i = 0; i < columns.size(); i++) {
                columns.get(i).set(record, entry.values().get(i));
            }
            record.recordState().restore(entry.state());
        }
        entries.clear();
    }

    private record Entry(ModelDescriptor<?> model, RecordState.Snapshot state, List<Object> values) {}
}
