package com.retailpos.pricing.dto;

import java.math.BigDecimal;

/**
 * A priced bill line. {@code rate} is the per-unit rate actually multiplied by the
 * quantity, so for gram lines it is already the per-gram rate.
 */
public record LineItem(
        Long productId,
        Long aliasId,
        String name,
        String barcode,
        String uom,
        BigDecimal quantity,
        BigDecimal rate,
        BigDecimal mrp,
        BigDecimal factor,
        BigDecimal grossAmount,
        BigDecimal discountAmount,
        BigDecimal lineAmount,
        String schemeName,
        BigDecimal savings) {

    public static LineItem blank(String token) {
        return new LineItem(null, null, "", token, "", BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ONE, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, BigDecimal.ZERO);
    }

    public boolean isBlank() {
        return productId == null;
    }
}
