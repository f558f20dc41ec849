package de.t14d3.spindle.test;

import de.t14d3.spindle.annotations.Column;
import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.annotations.Id;
import de.t14d3.spindle.annotations.JoinColumn;
import de.t14d3.spindle.annotations.OneToMany;
import de.t14d3.spindle.annotations.OneToOne;
import de.t14d3.spindle.core.Model;
import de.t14d3.spindle.exceptions.SchemaException;
import de.t14d3.spindle.mapping.FieldDescriptor;
import de.t14d3.spindle.mapping.FieldKind;
import de.t14d3.spindle.mapping.ModelDescriptor;
import de.t14d3.spindle.mapping.NamingConvention;
import de.t14d3.spindle.mapping.PrimaryKeyDescriptor;
import de.t14d3.spindle.mapping.RelationshipDescriptor;
import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.test.entities.Address;
import de.t14d3.spindle.test.entities.Car;
import de.t14d3.spindle.test.entities.Engine;
import de.t14d3.spindle.test.entities.Person;
import de.t14d3.spindle.test.entities.Pet;
import de.t14d3.spindle.test.entities.Profile;
import de.t14d3.spindle.test.entities.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaTest {

    @Test
    void testColumnsAndKinds() {
        ModelDescriptor<Person> person = TestDatabase.SCHEMA.descriptor(Person.class);

        assertEquals("person", person.getTable());
        assertEquals(List.of("id", "name", "age", "email", "tags", "attributes", "street", "city"),
                person.getColumnNames());
        assertEquals(FieldKind.SCALAR, person.getColumn("name").getKind());
        assertEquals(FieldKind.ARRAY, person.getColumn("tags").getKind());
        assertEquals(String.class, person.getColumn("tags").getElementType());
        assertEquals(FieldKind.JSON, person.getColumn("attributes").getKind());
        assertEquals("address.street", person.getColumn("street").getName());

        PrimaryKeyDescriptor pk = person.getPrimaryKey();
        assertEquals("id", pk.column());
        assertTrue(pk.autoIncrement());
        assertFalse(TestDatabase.SCHEMA.descriptor(Tag.class).getPrimaryKey().autoIncrement());

        assertThrows(IllegalArgumentException.class, () -> person.getColumn("nope"));

        assertFalse(pk.field().isNullable());
        assertTrue(person.getColumn("email").isNullable());
        assertFalse(TestDatabase.SCHEMA.descriptor(Engine.class).getColumn("horsepower").isNullable());

        FieldDescriptor address = person.getFields().get(person.getFields().size() - 1);
        assertEquals(FieldKind.INLINE, address.getKind());
        assertNull(address.getColumn());
        assertEquals(List.of("street", "city"), address.getChildren().stream().map(FieldDescriptor::getColumn).toList());
    }

    @Test
    void testRelationshipDirections() {
        ModelDescriptor<Person> person = TestDatabase.SCHEMA.descriptor(Person.class);

        RelationshipDescriptor pets = person.getRelationship("pets");
        assertEquals(RelationshipDescriptor.Kind.ONE_TO_MANY, pets.kind());
        assertEquals(RelationshipDescriptor.Direction.INVERSE, pets.direction());
        assertEquals("person_id", pets.foreignKey());
        assertEquals(Pet.class, pets.targetType());

        RelationshipDescriptor profile = person.getRelationship("profile");
        assertEquals(RelationshipDescriptor.Kind.ONE_TO_ONE, profile.kind());
        assertFalse(profile.isForward());

        RelationshipDescriptor engine = TestDatabase.SCHEMA.descriptor(Car.class).getRelationship("engine");
        assertTrue(engine.isForward());
        assertEquals("engine_id", engine.foreignKey());

        // foreign keys live on the table that stores them, without a mapped field
        assertEquals(List.of("person_id"), TestDatabase.SCHEMA.descriptor(Pet.class).getForeignKeyColumns());
        assertEquals(List.of("person_id"), TestDatabase.SCHEMA.descriptor(Profile.class).getForeignKeyColumns());
        assertEquals(List.of("engine_id"), TestDatabase.SCHEMA.descriptor(Car.class).getForeignKeyColumns());
        assertTrue(person.getForeignKeyColumns().isEmpty());
    }

    @Test
    void testInlineFieldsAreInstantiatedOnWrite() {
        ModelDescriptor<Person> person = TestDatabase.SCHEMA.descriptor(Person.class);
        Person p = person.newInstance();
        assertNull(p.getAddress());

        person.setColumnValue(p, "city", "Berlin");
        assertNotNull(p.getAddress());
        assertEquals("Berlin", p.getAddress().getCity());
        assertEquals("Berlin", person.getColumnValue(p, "city"));

        p.setAddress(new Address("Main St", null));
        assertEquals("Main St", person.getColumnValue(p, "street"));
    }

    @Test
    void testUnregisteredTargetIsRejected() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> Schema.builder().register(Person.class, Pet.class).build());
        assertTrue(e.getMessage().contains(Profile.class.getName()));
    }

    @Test
    void testDuplicateForeignKeyIsRejected() {
        assertThrows(SchemaException.class,
                () -> Schema.builder().register(Garage.class, Bike.class).build());
    }

    @Test
    void testNonEntityIsRejected() {
        assertThrows(SchemaException.class, () -> Schema.builder().register(NotAnEntity.class));
    }

    @Test
    void testUnknownTypeLookup() {
        Schema schema = Schema.builder().register(Tag.class).build();
        assertTrue(schema.contains(Tag.class));
        assertThrows(SchemaException.class, () -> schema.descriptor(Person.class));
    }

    @Test
    void testScanFindsEntities() {
        Schema scanned = Schema.scan("de.t14d3.spindle.test.entities");

        assertTrue(scanned.contains(Person.class));
        assertTrue(scanned.contains(Car.class));
        assertEquals(TestDatabase.SCHEMA.getModels().size(), scanned.getModels().size());
    }

    @Test
    void testEmptyKeyValues() {
        assertTrue(PrimaryKeyDescriptor.isEmptyValue(null));
        assertTrue(PrimaryKeyDescriptor.isEmptyValue(0L));
        assertTrue(PrimaryKeyDescriptor.isEmptyValue(0));
        assertTrue(PrimaryKeyDescriptor.isEmptyValue(""));
        assertTrue(PrimaryKeyDescriptor.isEmptyValue(new UUID(0L, 0L)));
        assertFalse(PrimaryKeyDescriptor.isEmptyValue(7L));
        assertFalse(PrimaryKeyDescriptor.isEmptyValue("abc"));
        assertFalse(PrimaryKeyDescriptor.isEmptyValue(UUID.randomUUID()));
    }

    @Test
    void testNamingConvention() {
        assertEquals("created_at", NamingConvention.toSnakeCase("createdAt"));
        assertEquals("http_server", NamingConvention.toSnakeCase("HTTPServer"));
        assertEquals("audited_note_id", NamingConvention.foreignKeyFor(de.t14d3.spindle.test.entities.AuditedNote.class));
    }

    @Entity
    static class Garage extends Model {
        @Id(autoIncrement = true)
        @Column
        private Long id;

        @OneToOne
        @JoinColumn(name = "wheel_id")
        private Bike first;

        @OneToOne
        @JoinColumn(name = "wheel_id")
        private Bike second;
    }

    @Entity
    static class Bike extends Model {
        @Id(autoIncrement = true)
        @Column
        private Long id;

        @OneToMany(targetEntity = Garage.class)
        private List<Garage> garages;
    }

    static class NotAnEntity extends Model {
        @Id
        private Long id;
    }
}
