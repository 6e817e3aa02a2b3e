package com.retailpos.pricing.dto;

import java.math.BigDecimal;

/**
 * One row of a product's unit table. {@code price} may be null on raw alias rows read from
 * the store; the unit table fills it in from the base price.
 */
public record UnitEntry(
        String uom,
        BigDecimal price,
        BigDecimal mrp,
        BigDecimal factor,
        Long aliasId) {

    public boolean isBase() {
        return aliasId == null;
    }
}
