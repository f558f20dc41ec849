package de.t14d3.spindle.sql;

import de.t14d3.spindle.query.Condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rendered SQL statement with its parameters, produced by the builders below.
 * Supports multiple SQL dialects with proper identifier quoting.
 */
public class Statement {
    private final Dialect dialect;
    private final String sql;
    private final List<Object> parameters;

    private Statement(Dialect dialect, String sql, List<Object> parameters) {
        this.dialect = dialect;
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    /**
     * Get the final SQL string.
     */
    public String getSql() {
        return sql;
    }

    /**
     * Get the parameters for prepared statement binding.
     */
    public List<Object> getParameters() {
        return parameters;
    }

    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public String toString() {
        return sql + " params=" + parameters;
    }

    /**
     * Create a new SELECT statement builder.
     */
    public static SelectBuilder select(Dialect dialect) {
        return new SelectBuilder(dialect);
    }

    /**
     * Create a new INSERT statement builder.
     */
    public static InsertBuilder insertInto(Dialect dialect, String table) {
        return new InsertBuilder(dialect).into(table);
    }

    /**
     * Create a new UPDATE statement builder.
     */
    public static UpdateBuilder update(Dialect dialect, String table) {
        return new UpdateBuilder(dialect).table(table);
    }

    /**
     * Create a new DELETE statement builder.
     */
    public static DeleteBuilder deleteFrom(Dialect dialect, String table) {
        return new DeleteBuilder(dialect).from(table);
    }

    // ========================================================================
    // SELECT
    // ========================================================================

    public static class SelectBuilder {
        private final SqlRenderer renderer;
        private final Dialect dialect;
        private final List<String> columns = new ArrayList<>();
        private String fromTable;
        private String fromAlias;
        private final StringBuilder joins = new StringBuilder();
        private final List<Object> joinParameters = new ArrayList<>();
        private final List<String> whereClauses = new ArrayList<>();
        private final List<Object> whereParameters = new ArrayList<>();
        private final List<String> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        public SelectBuilder(Dialect dialect) {
            this.dialect = dialect;
            this.renderer = new SqlRenderer(dialect);
        }

        public SelectBuilder from(String table) {
            return from(table, null);
        }

        public SelectBuilder from(String table, String alias) {
            this.fromTable = table;
            this.fromAlias = alias;
            return this;
        }

        public SelectBuilder column(String alias, String column) {
            columns.add(renderer.column(alias, column));
            return this;
        }

        public SelectBuilder columns(String alias, List<String> columns) {
            for (String column : columns) {
                column(alias, column);
            }
            return this;
        }

        public SelectBuilder count() {
            columns.add("COUNT(*)");
            return this;
        }

        /**
         * {@code LEFT JOIN table alias ON alias.column = parentAlias.parentColumn [AND filter]}.
         */
        public SelectBuilder leftJoin(String table, String alias, String column,
                                      String parentAlias, String parentColumn, Condition filter) {
            joins.append(" LEFT JOIN ").append(dialect.quoteIdentifier(table)).append(' ').append(alias)
                    .append(" ON ").append(renderer.column(alias, column))
                    .append(" = ").append(renderer.column(parentAlias, parentColumn));
            if (filter != null) {
                Fragment fragment = renderer.render(filter, alias);
                joins.append(" AND ").append(fragment.sql());
                joinParameters.addAll(fragment.parameters());
            }
            return this;
        }

        /**
         * AND a condition into the WHERE clause; {@code null} is ignored.
         */
        public SelectBuilder where(Condition condition) {
            if (condition != null) {
                Fragment fragment = renderer.render(condition, fromAlias);
                whereClauses.add(fragment.sql());
                whereParameters.addAll(fragment.parameters());
            }
            return this;
        }

        public SelectBuilder orderBy(String column, boolean descending) {
            orderBy.add(renderer.column(fromAlias, column) + (descending ? " DESC" : " ASC"));
            return this;
        }

        public SelectBuilder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public SelectBuilder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Statement build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("SELECT query must specify columns");
            }
            if (fromTable == null) {
                throw new IllegalStateException("SELECT query must specify a table");
            }

            StringBuilder sql = new StringBuilder("SELECT ");
            sql.append(String.join(", ", columns));
            sql.append(" FROM ").append(dialect.quoteIdentifier(fromTable));
            if (fromAlias != null) {
                sql.append(' ').append(fromAlias);
            }
            sql.append(joins);

            if (!whereClauses.isEmpty()) {
                sql.append(" WHERE ").append(String.join(" AND ", whereClauses));
            }
            if (!orderBy.isEmpty()) {
                sql.append(" ORDER BY ").append(String.join(", ", orderBy));
            }
            appendLimit(sql);

            List<Object> parameters = new ArrayList<>(joinParameters);
            parameters.addAll(whereParameters);
            return new Statement(dialect, sql.toString(), parameters);
        }

        private void appendLimit(StringBuilder sql) {
            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
            } else if (offset != null) {
                // MySQL and SQLite only accept OFFSET after a LIMIT
                if (dialect == Dialect.MYSQL) {
                    sql.append(" LIMIT 18446744073709551615");
                } else if (dialect == Dialect.SQLITE) {
                    sql.append(" LIMIT -1");
                }
            }
            if (offset != null) {
                sql.append(" OFFSET ").append(offset);
            }
        }
    }

    // ========================================================================
    // INSERT
    // ========================================================================

    public static class InsertBuilder {
        private final SqlRenderer renderer;
        private final Dialect dialect;
        private String table;
        private final List<String> columns = new ArrayList<>();
        private final List<String> valuePlaceholders = new ArrayList<>();
        private final List<Object> parameters = new ArrayList<>();

        public InsertBuilder(Dialect dialect) {
            this.dialect = dialect;
            this.renderer = new SqlRenderer(dialect);
        }

        public InsertBuilder into(String table) {
            this.table = table;
            return this;
        }

        public InsertBuilder value(String column, Object value) {
            columns.add(dialect.quoteIdentifier(column));
            valuePlaceholders.add(renderer.placeholder(value));
            parameters.add(value);
            return this;
        }

        public Statement build() {
            if (table == null) {
                throw new IllegalStateException("INSERT query must specify a table");
            }

            StringBuilder sql = new StringBuilder("INSERT INTO ");
            sql.append(dialect.quoteIdentifier(table));
            if (columns.isEmpty()) {
                sql.append(" DEFAULT VALUES");
            } else {
                sql.append(" (").append(String.join(", ", columns))
                        .append(") VALUES (")
                        .append(String.join(", ", valuePlaceholders))
                        .append(")");
            }

            return new Statement(dialect, sql.toString(), parameters);
        }
    }

    // ========================================================================
    // UPDATE
    // ========================================================================

    public static class UpdateBuilder {
        private final SqlRenderer renderer;
        private final Dialect dialect;
        private String table;
        private final List<String> setClauses = new ArrayList<>();
        private final List<Object> setParameters = new ArrayList<>();
        private final List<String> whereClauses = new ArrayList<>();
        private final List<Object> whereParameters = new ArrayList<>();

        public UpdateBuilder(Dialect dialect) {
            this.dialect = dialect;
            this.renderer = new SqlRenderer(dialect);
        }

        public UpdateBuilder table(String table) {
            this.table = table;
            return this;
        }

        public UpdateBuilder set(String column, Object value) {
            setClauses.add(dialect.quoteIdentifier(column) + " = " + renderer.placeholder(value));
            setParameters.add(value);
            return this;
        }

        public UpdateBuilder where(Condition condition) {
            if (condition != null) {
                Fragment fragment = renderer.render(condition);
                whereClauses.add(fragment.sql());
                whereParameters.addAll(fragment.parameters());
            }
            return this;
        }

        public Statement build() {
            if (table == null) {
                throw new IllegalStateException("UPDATE query must specify a table");
            }
            if (setClauses.isEmpty()) {
                throw new IllegalStateException("UPDATE query must specify at least one SET clause");
            }

            StringBuilder sql = new StringBuilder("UPDATE ");
            sql.append(dialect.quoteIdentifier(table));
            sql.append(" SET ").append(String.join(", ", setClauses));
            if (!whereClauses.isEmpty()) {
                sql.append(" WHERE ").append(String.join(" AND ", whereClauses));
            }

            List<Object> parameters = new ArrayList<>(setParameters);
            parameters.addAll(whereParameters);
            return new Statement(dialect, sql.toString(), parameters);
        }
    }

    // ========================================================================
    // DELETE
    // ========================================================================

    public static class DeleteBuilder {
        private final SqlRenderer renderer;
        private final Dialect dialect;
        private String table;
        private final List<String> whereClauses = new ArrayList<>();
        private final List<Object> parameters = new ArrayList<>();

        public DeleteBuilder(Dialect dialect) {
            this.dialect = dialect;
            this.renderer = new SqlRenderer(dialect);
        }

        public DeleteBuilder from(String table) {
            this.table = table;
            return this;
        }

        public DeleteBuilder where(Condition condition) {
            if (condition != null) {
                Fragment fragment = renderer.render(condition);
                whereClauses.add(fragment.sql());
                parameters.addAll(fragment.parameters());
            }
            return this;
        }

        public Statement build() {
            if (table == null) {
                throw new IllegalStateException("DELETE query must specify a table");
            }

            StringBuilder sql = new StringBuilder("DELETE FROM ");
            sql.append(dialect.quoteIdentifier(table));
            if (!whereClauses.isEmpty()) {
                sql.append(" WHERE ").append(String.join(" AND ", whereClauses));
            }

            return new Statement(dialect, sql.toString(), parameters);
        }
    }
}
