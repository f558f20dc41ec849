package de.t14d3.spindle.test;

import de.t14d3.spindle.core.Database;
import de.t14d3.spindle.core.Store;
import de.t14d3.spindle.sql.Dialect;
import de.t14d3.spindle.test.entities.Person;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DatabaseTest {
    private final DataSource dataSource = TestDatabase.dataSource("database_test");

    @BeforeEach
    void setup() {
        TestDatabase.createTables(dataSource);
    }

    @AfterEach
    void teardown() {
        TestDatabase.dropTables(dataSource);
    }

    @Test
    void testDialectIsDetected() {
        Database db = Database.create(dataSource);
        assertEquals(Dialect.H2, db.getDialect());
        assertSame(db.getExecutor(), db.getExecutor());
    }

    @Test
    void testStoreRequiresSchema() {
        Database db = Database.create(dataSource);
        assertThrows(IllegalStateException.class, () -> db.store(Person.class));
        assertThrows(IllegalArgumentException.class, () -> Database.create(null));
        assertThrows(IllegalArgumentException.class, () -> db.withDefaultBatchSize(0));
    }

    @Test
    void testStoresShareConfiguration() {
        Database db = Database.create(dataSource)
                .withSchema(TestDatabase.SCHEMA)
                .withDefaultBatchSize(20);
        Store<Person> people = db.store(Person.class);

        assertSame(TestDatabase.SCHEMA, people.getSchema());
        assertSame(db.getExecutor(), people.getExecutor());
        assertEquals(20, people.query().getBatchSize());

        people.insert(new Person("Alice", 34));
        assertEquals(1, db.store(Person.class).count());
    }

    @Test
    void testExplicitDialectOverridesDetection() {
        Database db = Database.create(dataSource)
                .withSchema(TestDatabase.SCHEMA)
                .withDialect(Dialect.MYSQL);
        assertEquals(Dialect.MYSQL, db.getDialect());
        assertEquals(Dialect.MYSQL, db.store(Person.class).getExecutor().dialect());

        RecordingExecutor executor = new RecordingExecutor(db.getExecutor());
        new Store<>(db.getSchema(), Person.class, executor).count();
        assertEquals("SELECT COUNT(*) FROM `person` t0", executor.statements().get(0));
    }
}
