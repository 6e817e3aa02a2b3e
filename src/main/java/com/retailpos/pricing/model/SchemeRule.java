package com.retailpos.pricing.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "scheme_rules")
@Data
public class SchemeRule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "scheme_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Scheme scheme;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal minQty = BigDecimal.ZERO;

    @Column(precision = 12, scale = 3)
    private BigDecimal maxQty;

    @Column(length = 20)
    private String targetUom;

    @Column(precision = 12, scale = 3)
    private BigDecimal targetMrp;

    @Column(nullable = false, length = 20)
    private BenefitType benefitType = BenefitType.PERCENT;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal benefitValue = BigDecimal.ZERO;
}
