package de.t14d3.spindle.test.entities;

import de.t14d3.spindle.annotations.Column;
import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.annotations.Id;
import de.t14d3.spindle.annotations.Inline;
import de.t14d3.spindle.annotations.Json;
import de.t14d3.spindle.annotations.OneToMany;
import de.t14d3.spindle.annotations.OneToOne;
import de.t14d3.spindle.annotations.Table;
import de.t14d3.spindle.core.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "person")
public class Person extends Model {
    @Id(autoIncrement = true)
    @Column(name = "id")
    private Long id;

    @Column(name = "name")
    private String name;

    @Column(name = "age")
    private Integer age;

    @Column(name = "email")
    private String email;

    @Column(name = "tags")
    private List<String> tags;

    @Json
    private Map<String, Object> attributes;

    @Inline
    private Address address;

    @OneToMany(targetEntity = Pet.class)
    private List<Pet> pets;

    @OneToOne(inverse = true)
    private Profile profile;

    public Person() {}

    public Person(String name, Integer age) {
        this.name = name;
        this.age = age;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Integer getAge() { return age; }
    public void setAge(Integer age) { this.age = age; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public Map<String, Object> getAttributes() { return attributes; }
    public void setAttributes(Map<String, Object> attributes) { this.attributes = attributes; }

    public Address getAddress() { return address; }
    public void setAddress(Address address) { this.address = address; }

    public List<Pet> getPets() { return pets; }
    public void setPets(List<Pet> pets) { this.pets = pets; }

    public void addPet(Pet pet) {
        if (pets == null) {
            pets = new ArrayList<>();
        }
        pets.add(pet);
    }

    public Profile getProfile() { return profile; }
    public void setProfile(Profile profile) { this.profile = profile; }

    @Override
    public String toString() {
        return "Person{id=" + id + ", name='" + name + "', age=" + age + '}';
    }
}
