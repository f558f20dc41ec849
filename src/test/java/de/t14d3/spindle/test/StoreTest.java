package de.t14d3.spindle.test;

import de.t14d3.spindle.connection.JdbcExecutor;
import de.t14d3.spindle.core.RecordSet;
import de.t14d3.spindle.core.SaveResult;
import de.t14d3.spindle.core.Store;
import de.t14d3.spindle.exceptions.NoRowsException;
import de.t14d3.spindle.exceptions.NotPersistedException;
import de.t14d3.spindle.exceptions.PreconditionException;
import de.t14d3.spindle.exceptions.ResultSetClosedException;
import de.t14d3.spindle.exceptions.StatementExecutionException;
import de.t14d3.spindle.query.Order;
import de.t14d3.spindle.query.Query;
import de.t14d3.spindle.test.entities.Address;
import de.t14d3.spindle.test.entities.Person;
import de.t14d3.spindle.test.entities.Tag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.util.List;

import static de.t14d3.spindle.query.Conditions.*;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class StoreTest {
    private final DataSource dataSource = TestDatabase.dataSource("store_test");
    private RecordingExecutor executor;
    private Store<Person> people;

    @BeforeEach
    void setup() {
        TestDatabase.createTables(dataSource);
        executor = new RecordingExecutor(new JdbcExecutor(dataSource));
        people = new Store<>(TestDatabase.SCHEMA, Person.class, executor);
    }

    @AfterEach
    void teardown() {
        TestDatabase.dropTables(dataSource);
    }

    private Person person(String name, int age) {
        Person person = new Person(name, age);
        people.insert(person);
        return person;
    }

    @Test
    void testInsertAssignsGeneratedKey() {
        Person alice = new Person("Alice", 34);
        alice.setAddress(new Address("Main Street 1", "Springfield"));
        assertFalse(alice.isPersisted());

        people.insert(alice);

        assertNotNull(alice.getId());
        assertTrue(alice.isPersisted());
        assertTrue(alice.isWritable());
        assertEquals(1, TestDatabase.count(dataSource, "person"));
        assertEquals(0, executor.transactions());

        Person loaded = people.findById(alice.getId());
        assertNotNull(loaded);
        assertNotSame(alice, loaded);
        assertEquals("Alice", loaded.getName());
        assertEquals(34, loaded.getAge());
        assertEquals("Springfield", loaded.getAddress().getCity());
        assertTrue(loaded.isPersisted());
        assertTrue(loaded.isWritable());

        assertNull(people.findById(alice.getId() + 100));
    }

    @Test
    void testInsertPreconditions() {
        Person alice = person("Alice", 34);
        assertThrows(PreconditionException.class, () -> people.insert(alice));

        Store<Tag> tags = people.storeFor(Tag.class);
        assertThrows(PreconditionException.class, () -> tags.insert(new Tag(null, "no code")));
        assertThrows(PreconditionException.class, () -> tags.insert(new Tag("", "empty code")));

        Tag java = new Tag("java", "Java");
        tags.insert(java);
        assertEquals("Java", tags.findById("java").getLabel());

        // the key is caller supplied, so a duplicate reaches the database
        assertThrows(StatementExecutionException.class, () -> tags.insert(new Tag("java", "Again")));
        assertEquals(1, TestDatabase.count(dataSource, "tag"));
    }

    @Test
    void testSaveInsertsThenUpdates() {
        Person bob = new Person("Bob", 40);
        assertEquals(SaveResult.INSERTED, people.save(bob));

        bob.setAge(41);
        assertEquals(SaveResult.UPDATED, people.save(bob));
        assertEquals(SaveResult.UPDATED, people.save(bob));
        assertEquals(2, executor.count("UPDATE"));

        assertEquals(1, TestDatabase.count(dataSource, "person"));
        assertEquals(41, people.findById(bob.getId()).getAge());
    }

    @Test
    void testUpdateSubsetOfColumns() {
        Person carol = person("Carol", 28);
        carol.setName("Caroline");
        carol.setAge(29);

        assertEquals(1, people.update(carol, "age"));

        Person loaded = people.findById(carol.getId());
        assertEquals("Carol", loaded.getName());
        assertEquals(29, loaded.getAge());

        assertThrows(IllegalArgumentException.class, () -> people.update(carol, "id"));
        assertThrows(IllegalArgumentException.class, () -> people.update(carol, "nickname"));
    }

    @Test
    void testUpdateOfVanishedRowAffectsNothing() {
        Person dave = person("Dave", 50);
        TestDatabase.execute(dataSource, "DELETE FROM person");

        dave.setAge(51);
        assertEquals(0, people.update(dave));
        assertEquals(0, TestDatabase.count(dataSource, "person"));
    }

    @Test
    void testWritesRequirePersistedRecords() {
        Person ghost = new Person("Ghost", 100);
        assertThrows(NotPersistedException.class, () -> people.update(ghost));
        assertThrows(NotPersistedException.class, () -> people.delete(ghost));
        assertThrows(NotPersistedException.class, () -> people.reload(ghost));
        assertTrue(executor.statements().isEmpty());
    }

    @Test
    void testDelete() {
        Person erin = person("Erin", 22);
        person("Frank", 33);

        assertEquals(1, people.delete(erin));
        assertFalse(erin.isPersisted());
        assertEquals(1, TestDatabase.count(dataSource, "person"));
        assertNull(people.findById(erin.getId()));

        // a deleted record can be inserted again
        erin.setId(null);
        people.insert(erin);
        assertEquals(2, people.count());
    }

    @Test
    void testReloadDiscardsLocalChanges() {
        Person gina = person("Gina", 45);
        gina.setName("changed locally");
        TestDatabase.execute(dataSource, "UPDATE person SET age = 46");

        people.reload(gina);

        assertEquals("Gina", gina.getName());
        assertEquals(46, gina.getAge());

        TestDatabase.execute(dataSource, "DELETE FROM person");
        assertThrows(NoRowsException.class, () -> people.reload(gina));
    }

    @Test
    void testQueryOrderLimitOffset() {
        for (int i = 1; i <= 10; i++) {
            person("P" + i, 20 + i);
        }

        List<Person> page = people.findAll(people.query()
                .where(gt("age", 22))
                .order(Order.desc("age"))
                .limit(3)
                .offset(2));
        assertEquals(List.of("P8", "P7", "P6"), page.stream().map(Person::getName).toList());

        assertEquals(8, people.count(people.query().where(gt("age", 22)).limit(1)));
        assertEquals(10, people.count());

        List<Person> some = people.findAll(people.query()
                .where(or(eq("name", "P1"), in("age", 29, 30)))
                .where(not(like("name", "%0")))
                .order(Order.asc("name")));
        assertEquals(List.of("P1", "P9"), some.stream().map(Person::getName).toList());
    }

    @Test
    void testFindOne() {
        person("Hank", 60);
        person("Ivy", 61);

        Person oldest = people.findOne(people.query().order(Order.desc("age")));
        assertEquals("Ivy", oldest.getName());
        assertTrue(executor.statements().get(executor.statements().size() - 1).contains("LIMIT 1"));

        assertThrows(NoRowsException.class, () -> people.findOne(people.query().where(eq("name", "nobody"))));
    }

    @Test
    void testNullComparisons() {
        Person jack = person("Jack", 30);
        Person kim = new Person("Kim", 31);
        kim.setEmail("kim@example.com");
        people.insert(kim);

        assertEquals(List.of(jack.getId()), ids(people.findAll(people.query().where(eq("email", null)))));
        assertEquals(List.of(kim.getId()), ids(people.findAll(people.query().where(isNotNull("email")))));
        assertEquals(1, people.count(people.query().where(ilike("email", "KIM@%"))));
    }

    private static List<Long> ids(List<Person> persons) {
        return persons.stream().map(Person::getId).toList();
    }

    @Test
    void testRecordSetIsLazyAndClosable() {
        for (int i = 0; i < 5; i++) {
            person("R" + i, i);
        }

        RecordSet<Person> records = people.find(people.query().order(Order.asc("age")));
        assertThrows(IllegalStateException.class, records::get);
        assertTrue(records.next());
        assertEquals("R0", records.get().getName());
        assertTrue(records.next());
        assertEquals("R1", records.get().getName());

        records.close();
        records.close();
        assertFalse(records.next());
        assertThrows(ResultSetClosedException.class, records::get);
    }

    @Test
    void testExhaustedRecordSetIsClosed() {
        person("Solo", 1);

        try (RecordSet<Person> records = people.find(people.query())) {
            assertTrue(records.next());
            assertFalse(records.next());
            assertFalse(records.next());
            assertThrows(ResultSetClosedException.class, records::get);
        }
    }

    @Test
    void testQueryForOtherTypeIsRejected() {
        Store<Tag> tags = people.storeFor(Tag.class);
        Query<Tag> tagQuery = tags.query();
        @SuppressWarnings({"unchecked", "rawtypes"})
        Query<Person> mismatched = (Query) tagQuery;
        assertThrows(IllegalArgumentException.class, () -> people.find(mismatched));
    }
}
