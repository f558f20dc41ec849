package de.t14d3.spindle.test.entities;

import de.t14d3.spindle.annotations.Column;
import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.annotations.Id;
import de.t14d3.spindle.annotations.Table;
import de.t14d3.spindle.core.Model;

@Entity
@Table(name = "tag")
public class Tag extends Model {
    @Id
    @Column(name = "code")
    private String code;

    @Column(name = "label")
    private String label;

    public Tag() {}

    public Tag(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }
}
