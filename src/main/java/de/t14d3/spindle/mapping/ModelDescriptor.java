package de.t14d3.spindle.mapping;

import de.t14d3.spindle.core.Record;
import de.t14d3.spindle.exceptions.SchemaException;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of a record type: table, columns, primary key and
 * relationships. Built once, then shared read-only by every store and query.
 *
 * @param <T> the record type
 */
public final class ModelDescriptor<T extends Record> {
    private final Class<T> type;
    private final String table;
    private final List<FieldDescriptor> fields;
    private final List<FieldDescriptor> columns;
    private final Map<String, FieldDescriptor> columnIndex;
    private final PrimaryKeyDescriptor primaryKey;
    private final List<RelationshipDescriptor> relationships;
    private final Map<String, RelationshipDescriptor> relationshipIndex;
    private final List<String> foreignKeyColumns;
    private final Constructor<T> constructor;

    private ModelDescriptor(Builder<T> builder) {
        this.type = builder.type;
        this.table = builder.table;
        this.fields = List.copyOf(builder.fields);
        this.primaryKey = builder.primaryKey;

        List<FieldDescriptor> flat = new ArrayList<>();
        Map<String, FieldDescriptor> index = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            for (FieldDescriptor column : field.flatten()) {
                if (index.putIfAbsent(column.getColumn(), column) != null) {
                    throw new SchemaException("Column " + column.getColumn() + " is mapped twice in " + type.getName());
                }
                flat.add(column);
            }
        }
        this.columns = List.copyOf(flat);
        this.columnIndex = Collections.unmodifiableMap(index);

        Map<String, RelationshipDescriptor> rels = new LinkedHashMap<>();
        for (RelationshipDescriptor relationship : builder.relationships) {
            rels.put(relationship.name(), relationship);
        }
        this.relationships = List.copyOf(builder.relationships);
        this.relationshipIndex = Collections.unmodifiableMap(rels);
        this.foreignKeyColumns = List.copyOf(builder.foreignKeyColumns);
        this.constructor = builder.constructor;
    }

    public static <T extends Record> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    public Class<T> getType() {
        return type;
    }

    public String getTable() {
        return table;
    }

    /**
     * Top-level fields in declaration order, inline containers included.
     */
    public List<FieldDescriptor> getFields() {
        return fields;
    }

    /**
     * Every column-backed field, inline fields flattened, in declaration order.
     */
    public List<FieldDescriptor> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return List.copyOf(columnIndex.keySet());
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public FieldDescriptor getColumn(String column) {
        FieldDescriptor field = columnIndex.get(column);
        if (field == null) {
            throw new IllegalArgumentException("Unknown column " + column + " on " + table);
        }
        return field;
    }

    public PrimaryKeyDescriptor getPrimaryKey() {
        return primaryKey;
    }

    public List<RelationshipDescriptor> getRelationships() {
        return relationships;
    }

    public RelationshipDescriptor getRelationship(String name) {
        RelationshipDescriptor relationship = relationshipIndex.get(name);
        if (relationship == null) {
            throw new IllegalArgumentException("Unknown relationship " + name + " on " + type.getName());
        }
        return relationship;
    }

    /**
     * Foreign key columns stored on this table that no field maps; their values
     * live in each record's {@link de.t14d3.spindle.core.RecordState}.
     */
    public List<String> getForeignKeyColumns() {
        return foreignKeyColumns;
    }

    /**
     * Reads a column value, mapped field or engine-managed foreign key.
     */
    public Object getColumnValue(Record record, String column) {
        FieldDescriptor field = columnIndex.get(column);
        if (field != null) {
            return field.get(record);
        }
        return record.recordState().getForeignKey(column);
    }

    /**
     * Writes a column value, mapped field or engine-managed foreign key.
     */
    public void setColumnValue(Record record, String column, Object value) {
        FieldDescriptor field = columnIndex.get(column);
        if (field != null) {
            field.set(record, TypeMapper.convertToJavaType(value, field.getJavaType()));
        } else {
            record.recordState().setForeignKey(column, value);
        }
    }

    /**
     * Creates a new, empty instance.
     */
    public T newInstance() {
        try {
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new SchemaException("Cannot instantiate entity " + type.getName(), e);
        }
    }

    @Override
    public String toString() {
        return "ModelDescriptor{" + type.getSimpleName() + " -> " + table + '}';
    }

    public static final class Builder<T extends Record> {
        private final Class<T> type;
        private String table;
        private final List<FieldDescriptor> fields = new ArrayList<>();
        private PrimaryKeyDescriptor primaryKey;
        private final List<RelationshipDescriptor> relationships = new ArrayList<>();
        private final List<String> foreignKeyColumns = new ArrayList<>();
        private Constructor<T> constructor;

        private Builder(Class<T> type) {
            this.type = type;
            this.table = NamingConvention.toSnakeCase(type.getSimpleName());
        }

        public Class<T> getType() {
            return type;
        }

        public String getTable() {
            return table;
        }

        public Builder<T> table(String table) {
            this.table = table;
            return this;
        }

        public Builder<T> field(FieldDescriptor field) {
            fields.add(field);
            return this;
        }

        /**
         * Adds the key field as a column and marks it as the primary key.
         */
        public Builder<T> primaryKey(FieldDescriptor field, boolean autoIncrement) {
            if (primaryKey != null) {
                throw new SchemaException("Entity " + type.getName() + " declares more than one @Id");
            }
            fields.add(field);
            this.primaryKey = new PrimaryKeyDescriptor(field, autoIncrement);
            return this;
        }

        public Builder<T> relationship(RelationshipDescriptor relationship) {
            relationships.add(relationship);
            return this;
        }

        public List<RelationshipDescriptor> getRelationships() {
            return Collections.unmodifiableList(relationships);
        }

        boolean mapsColumn(String column) {
            for (FieldDescriptor field : fields) {
                for (FieldDescriptor flat : field.flatten()) {
                    if (column.equals(flat.getColumn())) {
                        return true;
                    }
                }
            }
            return false;
        }

        /**
         * Registers an engine-managed foreign key column; ignored when a field
         * already maps the column.
         */
        public Builder<T> foreignKeyColumn(String column) {
            if (!mapsColumn(column) && !foreignKeyColumns.contains(column)) {
                foreignKeyColumns.add(column);
            }
            return this;
        }

        public ModelDescriptor<T> build() {
            if (primaryKey == null) {
                throw new SchemaException("Entity " + type.getName() + " must have a field annotated with @Id");
            }
            try {
                constructor = type.getDeclaredConstructor();
                constructor.setAccessible(true);
            } catch (NoSuchMethodException e) {
                throw new SchemaException("Cannot find parameterless constructor for entity " + type.getName(), e);
            }
            return new ModelDescriptor<>(this);
        }
    }
}
