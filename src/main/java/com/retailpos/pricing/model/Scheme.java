package com.retailpos.pricing.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "schemes")
@Data
public class Scheme {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    private LocalDate validFrom;

    // Open ended when null
    private LocalDate validTo;

    private boolean active = true;

    @OneToMany(mappedBy = "scheme", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<SchemeRule> rules = new ArrayList<>();

    public void addRule(SchemeRule rule) {
        rule.setScheme(this);
        rules.add(rule);
    }
}
