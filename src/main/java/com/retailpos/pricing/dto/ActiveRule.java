package com.retailpos.pricing.dto;

import com.retailpos.pricing.model.BenefitType;

import java.math.BigDecimal;

public record ActiveRule(
        Long ruleId,
        Long schemeId,
        String schemeName,
        Long productId,
        BigDecimal minQty,
        BigDecimal maxQty,
        String targetUom,
        BigDecimal targetMrp,
        BenefitType benefitType,
        BigDecimal benefitValue) {
}
