package com.retailpos.pricing.dto;

import java.math.BigDecimal;

public record LineRequest(
        String token,
        BigDecimal quantity,
        String uom,
        BigDecimal mrp) {
}
