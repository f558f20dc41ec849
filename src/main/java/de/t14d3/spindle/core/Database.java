package de.t14d3.spindle.core;

import de.t14d3.spindle.connection.JdbcExecutor;
import de.t14d3.spindle.connection.SqlExecutor;
import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.query.Query;
import de.t14d3.spindle.sql.Dialect;

import javax.sql.DataSource;

/**
 * Wires a data source and a schema into stores.
 * <pre>{@code
 * Database db = Database.create(dataSource)
 *         .withSchema(Schema.scan("com.example.model"))
 *         .withDefaultBatchSize(100);
 * Store<Person> people = db.store(Person.class);
 * }</pre>
 */
public class Database {
    private final DataSource dataSource;
    private Schema schema;
    private Dialect dialect;
    private int defaultBatchSize = Query.DEFAULT_BATCH_SIZE;
    private SqlExecutor executor;

    private Database(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create a new Database over the given data source. The dialect is detected
     * from the connection metadata unless set with {@link #withDialect}.
     */
    public static Database create(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        return new Database(dataSource);
    }

    public Database withSchema(Schema schema) {
        this.schema = schema;
        return this;
    }

    public Database withDialect(Dialect dialect) {
        this.dialect = dialect;
        this.executor = null;
        return this;
    }

    public Database withDefaultBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.defaultBatchSize = batchSize;
        return this;
    }

    public Schema getSchema() {
        return schema;
    }

    public synchronized SqlExecutor getExecutor() {
        if (executor == null) {
            executor = dialect == null ? new JdbcExecutor(dataSource) : new JdbcExecutor(dataSource, dialect);
        }
        return executor;
    }

    public Dialect getDialect() {
        return getExecutor().dialect();
    }

    public <T extends Record> Store<T> store(Class<T> type) {
        if (schema == null) {
            throw new IllegalStateException("No schema configured; call withSchema first");
        }
        return new Store<>(schema, type, getExecutor(), defaultBatchSize);
    }
}
