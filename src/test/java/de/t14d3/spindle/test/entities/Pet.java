package de.t14d3.spindle.test.entities;

import de.t14d3.spindle.annotations.Column;
import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.annotations.Id;
import de.t14d3.spindle.annotations.Table;
import de.t14d3.spindle.core.Model;
import de.t14d3.spindle.hooks.BeforeInsert;

/**
 * Owned by a {@link Person}; the person_id column is managed by the engine.
 */
@Entity
@Table(name = "pet")
public class Pet extends Model implements BeforeInsert {
    @Id(autoIncrement = true)
    @Column(name = "id")
    private Long id;

    @Column(name = "name")
    private String name;

    @Column(name = "species")
    private String species;

    public Pet() {}

    public Pet(String name, String species) {
        this.name = name;
        this.species = species;
    }

    @Override
    public void beforeInsert() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("a pet needs a name");
        }
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSpecies() { return species; }
    public void setSpecies(String species) { this.species = species; }
}
