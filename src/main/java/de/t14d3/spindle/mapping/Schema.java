package de.t14d3.spindle.mapping;

import de.t14d3.spindle.core.Record;
import de.t14d3.spindle.exceptions.SchemaException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The set of model descriptors an application works with. Constructed once,
 * validated for consistency, and passed to every store.
 */
public final class Schema {
    private final Map<Class<?>, ModelDescriptor<?>> models;

    private Schema(Map<Class<?>, ModelDescriptor<?>> models) {
        this.models = Collections.unmodifiableMap(models);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a schema from every {@link de.t14d3.spindle.annotations.Entity} class
     * found under the given packages.
     */
    public static Schema scan(String... packages) {
        Builder builder = builder();
        for (Class<? extends Record> type : EntityScanner.scan(packages)) {
            builder.register(type);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    public <T extends Record> ModelDescriptor<T> descriptor(Class<T> type) {
        ModelDescriptor<?> descriptor = models.get(type);
        if (descriptor == null) {
            throw new SchemaException("Type " + type.getName() + " is not registered in the schema");
        }
        return (ModelDescriptor<T>) descriptor;
    }

    /**
     * Descriptor of the related side of {@code relationship}.
     */
    public ModelDescriptor<? extends Record> target(RelationshipDescriptor relationship) {
        return descriptor(relationship.targetType());
    }

    public boolean contains(Class<?> type) {
        return models.containsKey(type);
    }

    public Collection<ModelDescriptor<?>> getModels() {
        return models.values();
    }

    public static final class Builder {
        private final Map<Class<?>, ModelDescriptor.Builder<?>> builders = new LinkedHashMap<>();

        private Builder() {
        }

        @SafeVarargs
        public final Builder register(Class<? extends Record>... types) {
            for (Class<? extends Record> type : types) {
                if (!builders.containsKey(type)) {
                    builders.put(type, ModelReader.read(type));
                }
            }
            return this;
        }

        /**
         * Adds a hand-assembled model, for types that are not annotated.
         */
        public Builder add(ModelDescriptor.Builder<?> model) {
            builders.put(model.getType(), model);
            return this;
        }

        public Schema build() {
            Map<String, Set<String>> foreignKeysByTable = new HashMap<>();
            for (ModelDescriptor.Builder<?> owner : builders.values()) {
                for (RelationshipDescriptor relationship : owner.getRelationships()) {
                    ModelDescriptor.Builder<?> target = builders.get(relationship.targetType());
                    if (target == null) {
                        throw new SchemaException("Relationship " + owner.getType().getName() + "." + relationship.name()
                                + " targets unregistered type " + relationship.targetType().getName());
                    }
                    ModelDescriptor.Builder<?> keyHolder = relationship.isForward() ? owner : target;
                    Set<String> keys = foreignKeysByTable.computeIfAbsent(keyHolder.getTable(), t -> new HashSet<>());
                    if (!keys.add(relationship.foreignKey())) {
                        throw new SchemaException("Foreign key column " + relationship.foreignKey()
                                + " is used by more than one relationship on table " + keyHolder.getTable());
                    }
                    keyHolder.foreignKeyColumn(relationship.foreignKey());
                }
            }

            Map<Class<?>, ModelDescriptor<?>> models = new LinkedHashMap<>();
            List<String> tables = new ArrayList<>();
            for (ModelDescriptor.Builder<?> builder : builders.values()) {
                if (tables.contains(builder.getTable())) {
                    throw new SchemaException("Table " + builder.getTable() + " is mapped by more than one type");
                }
                tables.add(builder.getTable());
                models.put(builder.getType(), builder.build());
            }
            return new Schema(models);
        }
    }
}
