package com.retailpos.pricing.dto;

public record ScoredVariant(
        Variant variant,
        double nameSimilarity,
        double barcodeSimilarity) {

    public double score() {
        return Math.max(nameSimilarity, barcodeSimilarity);
    }
}
