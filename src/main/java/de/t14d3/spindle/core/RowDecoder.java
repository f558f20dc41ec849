package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.RowCursor;
import de.t14d3.spindle.mapping.FieldDescriptor;
import de.t14d3.spindle.mapping.JsonCodec;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.TypeMapper;
import de.t14d3.spindle.sql.ArrayValue;
import de.t14d3.spindle.sql.Dialect;
import de.t14d3.spindle.sql.JsonValue;

import java.util.List;

/**
 * Converts between field values and column values, in both directions, according
 * to each field's kind.
 */
final class RowDecoder {
    private RowDecoder() {
    }

    /**
     * Decode a new persisted record from {@code columns}, read starting at {@code offset}.
     */
    static <R extends Record> R decode(ModelDescriptor<R> model, List<String> columns, RowCursor cursor,
                                       int offset, boolean writable) {
        R record = model.newInstance();
        populate(model, columns, cursor, offset, record);
        record.recordState().setWritable(writable);
        return record;
    }

    /**
     * Overwrite the given columns of {@code record} from the current row. Columns not
     * listed keep their current value.
     */
    static void populate(ModelDescriptor<?> model, List<String> columns, RowCursor cursor, int offset, Record record) {
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            Object raw = cursor.get(offset + i);
            if (model.hasColumn(column)) {
                FieldDescriptor field = model.getColumn(column);
                field.set(record, fromColumn(field, raw));
            } else {
                record.recordState().setForeignKey(column, raw);
            }
        }
        record.recordState().setPersisted(true);
    }

    static Object fromColumn(FieldDescriptor field, Object raw) {
        if (raw == null) {
            return null;
        }
        return switch (field.getKind()) {
            case ARRAY -> TypeMapper.convertToArrayField(raw, field.getJavaType(), field.getElementType());
            case JSON -> JsonCodec.decode(raw, field.getGenericType());
            default -> TypeMapper.convertToJavaType(raw, field.getJavaType());
        };
    }

    /**
     * The parameter to bind for a field value. MySQL has no array type, so array
     * fields are stored there as JSON arrays.
     */
    static Object toColumn(FieldDescriptor field, Object value, Dialect dialect) {
        return switch (field.getKind()) {
            case ARRAY -> dialect == Dialect.MYSQL
                    ? new JsonValue(JsonCodec.encode(TypeMapper.toArrayElements(value)))
                    : new ArrayValue(TypeMapper.javaTypeToSqlType(field.getElementType()),
                    TypeMapper.toArrayElements(value));
            case JSON -> new JsonValue(JsonCodec.encode(value));
            default -> value;
        };
    }
}
