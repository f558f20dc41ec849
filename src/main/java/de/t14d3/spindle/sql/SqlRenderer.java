package de.t14d3.spindle.sql;

import de.t14d3.spindle.mapping.JsonCodec;
import de.t14d3.spindle.mapping.TypeMapper;
import de.t14d3.spindle.query.ArrayCondition;
import de.t14d3.spindle.query.Comparison;
import de.t14d3.spindle.query.Condition;
import de.t14d3.spindle.query.InCondition;
import de.t14d3.spindle.query.JsonCondition;
import de.t14d3.spindle.query.Junction;
import de.t14d3.spindle.query.Negation;
import de.t14d3.spindle.query.NullCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link Condition} trees into parameterized SQL for one {@link Dialect}.
 * Values are always bound as parameters, never inlined.
 */
public class SqlRenderer {
    private final Dialect dialect;

    public SqlRenderer(Dialect dialect) {
        this.dialect = dialect;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public Fragment render(Condition condition) {
        return render(condition, null);
    }

    /**
     * Render a condition, qualifying every column with {@code alias} when it is not {@code null}.
     */
    public Fragment render(Condition condition, String alias) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        append(condition, alias, sql, params);
        return new Fragment(sql.toString(), params);
    }

    /**
     * A quoted column reference, optionally qualified with a table alias.
     */
    public String column(String alias, String column) {
        String quoted = dialect.quoteIdentifier(column);
        return alias == null ? quoted : alias + "." + quoted;
    }

    /**
     * The placeholder a value binds to; JSON documents need a dialect-specific cast.
     */
    public String placeholder(Object value) {
        if (value instanceof JsonValue json && json.json() != null) {
            return dialect.jsonPlaceholder();
        }
        return "?";
    }

    private void append(Condition condition, String alias, StringBuilder sql, List<Object> params) {
        if (condition instanceof Comparison comparison) {
            appendComparison(comparison, alias, sql, params);
        } else if (condition instanceof InCondition in) {
            appendIn(in, alias, sql, params);
        } else if (condition instanceof NullCondition isNull) {
            sql.append(column(alias, isNull.column())).append(isNull.negated() ? " IS NOT NULL" : " IS NULL");
        } else if (condition instanceof Junction junction) {
            String separator = junction.type() == Junction.Type.AND ? " AND " : " OR ";
            sql.append('(');
            for (int i = 0; i < junction.children().size(); i++) {
                if (i > 0) {
                    sql.append(separator);
                }
                append(junction.children().get(i), alias, sql, params);
            }
            sql.append(')');
        } else if (condition instanceof Negation negation) {
            sql.append("NOT (");
            append(negation.child(), alias, sql, params);
            sql.append(')');
        } else if (condition instanceof JsonCondition json) {
            appendJson(json, alias, sql, params);
        } else if (condition instanceof ArrayCondition array) {
            appendArray(array, alias, sql, params);
        } else {
            throw new IllegalArgumentException("Unsupported condition type: " + condition.getClass().getName());
        }
    }

    private void appendComparison(Comparison comparison, String alias, StringBuilder sql, List<Object> params) {
        String col = column(alias, comparison.column());
        if (comparison.operator() == Comparison.Operator.ILIKE && !dialect.supportsIlike()) {
            sql.append("LOWER(").append(col).append(") LIKE LOWER(?)");
        } else {
            sql.append(col).append(' ').append(comparison.operator().sql()).append(" ?");
        }
        params.add(comparison.value());
    }

    private void appendIn(InCondition in, String alias, StringBuilder sql, List<Object> params) {
        if (in.values().isEmpty()) {
            sql.append(in.negated() ? "1=1" : "1=0");
            return;
        }
        sql.append(column(alias, in.column())).append(in.negated() ? " NOT IN (" : " IN (");
        for (int i = 0; i < in.values().size(); i++) {
            sql.append(i > 0 ? ", ?" : "?");
            params.add(in.values().get(i));
        }
        sql.append(')');
    }

    private void appendJson(JsonCondition json, String alias, StringBuilder sql, List<Object> params) {
        String col = column(alias, json.column());
        if (dialect == Dialect.POSTGRESQL) {
            // JDBC reserves '?', so the key operators are escaped as '??'
            switch (json.operator()) {
                case HAS_KEY -> {
                    sql.append(col).append(" ?? ?");
                    params.add(json.keys().get(0));
                }
                case HAS_ANY_KEY -> {
                    sql.append(col).append(" ??| ?");
                    params.add(new ArrayValue("text", json.keys().toArray()));
                }
                case HAS_ALL_KEYS -> {
                    sql.append(col).append(" ??& ?");
                    params.add(new ArrayValue("text", json.keys().toArray()));
                }
                case CONTAINS -> {
                    sql.append(col).append(" @> CAST(? AS JSONB)");
                    params.add(document(json.document()));
                }
                case CONTAINED_BY -> {
                    sql.append(col).append(" <@ CAST(? AS JSONB)");
                    params.add(document(json.document()));
                }
                case PATH_EXISTS -> {
                    sql.append("jsonb_extract_path(").append(col);
                    for (String segment : json.keys()) {
                        sql.append(", ?");
                        params.add(segment);
                    }
                    sql.append(") IS NOT NULL");
                }
            }
        } else if (dialect == Dialect.MYSQL) {
            switch (json.operator()) {
                case HAS_KEY, HAS_ANY_KEY, HAS_ALL_KEYS -> {
                    String mode = json.operator() == JsonCondition.Operator.HAS_ALL_KEYS ? "all" : "one";
                    sql.append("JSON_CONTAINS_PATH(").append(col).append(", '").append(mode).append('\'');
                    for (String key : json.keys()) {
                        sql.append(", ?");
                        params.add("$." + quoteJsonKey(key));
                    }
                    sql.append(')');
                }
                case CONTAINS -> {
                    sql.append("JSON_CONTAINS(").append(col).append(", ?)");
                    params.add(document(json.document()));
                }
                case CONTAINED_BY -> {
                    sql.append("JSON_CONTAINS(?, ").append(col).append(')');
                    params.add(document(json.document()));
                }
                case PATH_EXISTS -> {
                    StringBuilder path = new StringBuilder("$");
                    for (String segment : json.keys()) {
                        path.append('.').append(quoteJsonKey(segment));
                    }
                    sql.append("JSON_CONTAINS_PATH(").append(col).append(", 'one', ?)");
                    params.add(path.toString());
                }
            }
        } else {
            throw new UnsupportedOperationException("JSON operator " + json.operator() + " is not supported for " + dialect);
        }
    }

    private void appendArray(ArrayCondition array, String alias, StringBuilder sql, List<Object> params) {
        String col = column(alias, array.column());
        if (dialect == Dialect.POSTGRESQL) {
            String operator = switch (array.operator()) {
                case CONTAINS -> " @> ?";
                case CONTAINED_BY -> " <@ ?";
                case OVERLAPS -> " && ?";
            };
            sql.append(col).append(operator);
            params.add(arrayValue(array.values()));
        } else if (dialect == Dialect.H2) {
            if (array.operator() == ArrayCondition.Operator.CONTAINED_BY) {
                throw new UnsupportedOperationException("Array operator CONTAINED_BY is not supported for " + dialect);
            }
            boolean all = array.operator() == ArrayCondition.Operator.CONTAINS;
            if (array.values().isEmpty()) {
                sql.append(all ? "1=1" : "1=0");
                return;
            }
            Object[] elements = TypeMapper.toArrayElements(array.values());
            sql.append('(');
            for (int i = 0; i < elements.length; i++) {
                if (i > 0) {
                    sql.append(all ? " AND " : " OR ");
                }
                sql.append("ARRAY_CONTAINS(").append(col).append(", ?)");
                params.add(elements[i]);
            }
            sql.append(')');
        } else if (dialect == Dialect.MYSQL) {
            // MySQL has no array type; array columns are stored as JSON arrays
            String json = JsonCodec.encode(TypeMapper.toArrayElements(array.values()));
            switch (array.operator()) {
                case CONTAINS -> sql.append("JSON_CONTAINS(").append(col).append(", ?)");
                case CONTAINED_BY -> sql.append("JSON_CONTAINS(?, ").append(col).append(')');
                case OVERLAPS -> sql.append("JSON_OVERLAPS(").append(col).append(", ?)");
            }
            params.add(json);
        } else {
            throw new UnsupportedOperationException("Array operator " + array.operator() + " is not supported for " + dialect);
        }
    }

    private static String document(Object document) {
        if (document instanceof JsonValue json) {
            return json.json();
        }
        return JsonCodec.encode(document);
    }

    private static String quoteJsonKey(String key) {
        return '"' + key.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    /**
     * Wrap values as an array parameter, typed after the first non-null element.
     */
    public static ArrayValue arrayValue(List<?> values) {
        Class<?> elementType = String.class;
        for (Object value : values) {
            if (value != null) {
                elementType = value.getClass();
                break;
            }
        }
        return new ArrayValue(TypeMapper.javaTypeToSqlType(elementType), TypeMapper.toArrayElements(values));
    }
}
