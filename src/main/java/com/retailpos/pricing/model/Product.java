package com.retailpos.pricing.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "products")
@Data
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(unique = true, length = 50)
    private String barcode;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal mrp = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal price;

    @Column(length = 100)
    private String category = "General";

    @Column(length = 20)
    private String baseUom = "pcs";

    // Soft delete, purged after the retention window
    private boolean deleted = false;

    private LocalDateTime deletedAt;
}
