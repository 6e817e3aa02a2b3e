package com.retailpos.pricing.dto;

import com.retailpos.pricing.model.BenefitType;

import java.math.BigDecimal;

public record RuleDraft(
        Long productId,
        BigDecimal minQty,
        BigDecimal maxQty,
        String targetUom,
        BigDecimal targetMrp,
        BenefitType benefitType,
        BigDecimal benefitValue) {
}
