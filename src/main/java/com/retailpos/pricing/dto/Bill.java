package com.retailpos.pricing.dto;

import java.math.BigDecimal;
import java.util.List;

public record Bill(
        List<LineItem> lines,
        BigDecimal totalQuantity,
        BigDecimal netAmount,
        BigDecimal roundedTotal) {
}
