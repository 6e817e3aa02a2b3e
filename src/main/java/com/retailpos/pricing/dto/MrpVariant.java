package com.retailpos.pricing.dto;

import java.math.BigDecimal;

public record MrpVariant(
        BigDecimal mrp,
        BigDecimal price) {
}
