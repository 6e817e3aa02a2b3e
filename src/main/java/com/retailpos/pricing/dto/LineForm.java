package com.retailpos.pricing.dto;

// Raw grid cells as typed by the operator
public record LineForm(
        String token,
        String quantity,
        String uom,
        String mrp) {
}
