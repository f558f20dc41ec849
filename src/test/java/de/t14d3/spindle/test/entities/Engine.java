package de.t14d3.spindle.test.entities;

import de.t14d3.spindle.annotations.Column;
import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.annotations.Id;
import de.t14d3.spindle.annotations.Table;
import de.t14d3.spindle.core.Model;

@Entity
@Table(name = "engine")
public class Engine extends Model {
    @Id(autoIncrement = true)
    @Column(name = "id")
    private Long id;

    @Column(name = "horsepower")
    private int horsepower;

    public Engine() {}

    public Engine(int horsepower) {
        this.horsepower = horsepower;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public int getHorsepower() { return horsepower; }
    public void setHorsepower(int horsepower) { this.horsepower = horsepower; }
}
