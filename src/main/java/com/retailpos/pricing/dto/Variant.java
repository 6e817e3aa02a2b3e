package com.retailpos.pricing.dto;

import java.math.BigDecimal;

/**
 * A sellable unit of a product: either the product itself (the base variant) or one of its
 * packaging aliases. {@code aliasId} is null for base variants.
 */
public record Variant(
        Long productId,
        Long aliasId,
        String displayName,
        String barcode,
        String uom,
        BigDecimal mrp,
        BigDecimal price,
        BigDecimal factor,
        BigDecimal loadQty,
        BigDecimal basePrice,
        String category,
        boolean isAlias) {
}
