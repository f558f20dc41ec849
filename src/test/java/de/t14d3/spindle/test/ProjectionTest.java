package de.t14d3.spindle.test;

import de.t14d3.spindle.connection.JdbcExecutor;
import de.t14d3.spindle.core.Store;
import de.t14d3.spindle.exceptions.NotWritableException;
import de.t14d3.spindle.test.entities.Person;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Partial loads: records read through a column subset must not be written back.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ProjectionTest {
    private final DataSource dataSource = TestDatabase.dataSource("projection_test");
    private RecordingExecutor executor;
    private Store<Person> people;
    private Person alice;

    @BeforeEach
    void setup() {
        TestDatabase.createTables(dataSource);
        executor = new RecordingExecutor(new JdbcExecutor(dataSource));
        people = new Store<>(TestDatabase.SCHEMA, Person.class, executor);

        alice = new Person("Alice", 34);
        alice.setEmail("alice@example.com");
        alice.setTags(List.of("admin"));
        people.insert(alice);
        executor.reset();
    }

    @AfterEach
    void teardown() {
        TestDatabase.dropTables(dataSource);
    }

    @Test
    void testSelectLoadsOnlyNamedColumns() {
        Person partial = people.findOne(people.query().select("name"));

        String sql = executor.statements().get(0);
        assertTrue(sql.contains("\"NAME\""));
        assertFalse(sql.contains("\"EMAIL\""));

        assertEquals(alice.getId(), partial.getId());
        assertEquals("Alice", partial.getName());
        assertNull(partial.getAge());
        assertNull(partial.getEmail());
        assertNull(partial.getTags());
        assertTrue(partial.isPersisted());
        assertFalse(partial.isWritable());
    }

    @Test
    void testPartialRecordsCannotBeWritten() {
        Person partial = people.findOne(people.query().select("name"));
        partial.setName("Mallory");

        assertThrows(NotWritableException.class, () -> people.update(partial));
        assertThrows(NotWritableException.class, () -> people.update(partial, "name"));
        assertThrows(NotWritableException.class, () -> people.save(partial));

        assertEquals("Alice", people.findById(alice.getId()).getName());
        assertEquals("alice@example.com", people.findById(alice.getId()).getEmail());
    }

    @Test
    void testPartialRecordsCanBeDeleted() {
        Person partial = people.findOne(people.query().select("name"));

        // deleting only needs the key
        assertEquals(1, people.delete(partial));
        assertEquals(0, people.count());
    }

    @Test
    void testReloadMakesRecordWritable() {
        Person partial = people.findOne(people.query().select("name"));
        people.reload(partial);

        assertTrue(partial.isWritable());
        assertEquals(34, partial.getAge());
        assertEquals("alice@example.com", partial.getEmail());

        partial.setAge(35);
        assertEquals(1, people.update(partial));
        assertEquals(35, people.findById(alice.getId()).getAge());
        assertEquals(List.of("admin"), people.findById(alice.getId()).getTags());
    }

    @Test
    void testSelectNot() {
        Person partial = people.findOne(people.query().selectNot("email"));

        assertEquals("Alice", partial.getName());
        assertEquals(34, partial.getAge());
        assertNull(partial.getEmail());
        assertFalse(partial.isWritable());
    }

    @Test
    void testSelectingEveryColumnStaysWritable() {
        String[] all = people.getModel().getColumnNames().toArray(new String[0]);
        Person full = people.findOne(people.query().select(all));
        assertTrue(full.isWritable());
    }
}
