package com.retailpos.pricing.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

@Entity
@Table(name = "product_aliases")
@Data
public class ProductAlias {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Column(unique = true, length = 50)
    private String barcode;

    @Column(nullable = false, length = 20)
    private String uom;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal mrp = BigDecimal.ZERO;

    // Null means "base price x factor", worked out at lookup time
    @Column(precision = 12, scale = 3)
    private BigDecimal price;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal factor = BigDecimal.ONE;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal loadQty = BigDecimal.ONE;
}
