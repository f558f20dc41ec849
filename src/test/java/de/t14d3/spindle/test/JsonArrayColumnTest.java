package de.t14d3.spindle.test;

import de.t14d3.spindle.connection.JdbcExecutor;
import de.t14d3.spindle.core.Store;
import de.t14d3.spindle.query.Order;
import de.t14d3.spindle.test.entities.Person;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static de.t14d3.spindle.query.Conditions.*;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class JsonArrayColumnTest {
    private final DataSource dataSource = TestDatabase.dataSource("json_array_test");
    private Store<Person> people;

    @BeforeEach
    void setup() {
        TestDatabase.createTables(dataSource);
        people = new Store<>(TestDatabase.SCHEMA, Person.class, new JdbcExecutor(dataSource));
    }

    @AfterEach
    void teardown() {
        TestDatabase.dropTables(dataSource);
    }

    private Person person(String name, String... tags) {
        Person person = new Person(name, 30);
        person.setTags(List.of(tags));
        people.insert(person);
        return person;
    }

    @Test
    void testNestedJsonRoundTrip() {
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("daily", 10);
        limits.put("monthly", 250);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("theme", "dark");
        attributes.put("beta", true);
        attributes.put("limits", limits);
        attributes.put("devices", List.of("phone", "laptop"));

        Person alice = new Person("Alice", 34);
        alice.setAttributes(attributes);
        people.insert(alice);

        Person loaded = people.findById(alice.getId());
        assertEquals(attributes, loaded.getAttributes());

        loaded.getAttributes().put("theme", "light");
        people.update(loaded, "attributes");
        assertEquals("light", people.findById(alice.getId()).getAttributes().get("theme"));
    }

    @Test
    void testArrayRoundTrip() {
        Person bob = person("Bob", "admin", "ops");

        Person loaded = people.findById(bob.getId());
        assertEquals(List.of("admin", "ops"), loaded.getTags());

        loaded.setTags(List.of());
        people.update(loaded);
        assertEquals(List.of(), people.findById(bob.getId()).getTags());
    }

    @Test
    void testNullDocumentAndArray() {
        Person carol = new Person("Carol", 28);
        people.insert(carol);

        Person loaded = people.findById(carol.getId());
        assertNull(loaded.getAttributes());
        assertNull(loaded.getTags());
    }

    @Test
    void testArrayConditions() {
        person("Dave", "admin", "ops");
        person("Erin", "ops");
        person("Frank", "dev");

        List<Person> ops = people.findAll(people.query().where(arrayContains("tags", "ops")).order(Order.asc("name")));
        assertEquals(List.of("Dave", "Erin"), ops.stream().map(Person::getName).toList());

        assertEquals(1, people.count(people.query().where(arrayContains("tags", "admin", "ops"))));
        assertEquals(2, people.count(people.query().where(arrayOverlaps("tags", "admin", "dev"))));
        assertEquals(3, people.count(people.query().where(arrayContains("tags"))));
        assertEquals(0, people.count(people.query().where(arrayOverlaps("tags"))));
    }

    @Test
    void testJsonConditionsNeedJsonOperators() {
        assertThrows(UnsupportedOperationException.class,
                () -> people.findAll(people.query().where(jsonHasKey("attributes", "theme"))));
    }
}
