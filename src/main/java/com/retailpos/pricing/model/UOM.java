package com.retailpos.pricing.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "uoms")
@Data
public class UOM {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 20)
    private String name; // e.g. kilogram, gram, packet

    @Column(unique = true, length = 10)
    private String alias; // e.g. kg, g, pkt
}
