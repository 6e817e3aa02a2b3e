package com.retailpos.pricing.model;

public enum BenefitType {
    PERCENT("percent"),
    AMOUNT("amount"),
    ABSOLUTE_RATE("absolute_rate");

    private final String value;

    BenefitType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BenefitType fromValue(String text) {
        if (text == null || text.trim().isEmpty()) {
            return PERCENT;
        }
        String input = text.trim();
        for (BenefitType type : values()) {
            if (type.value.equalsIgnoreCase(input) || type.name().equalsIgnoreCase(input)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown benefit type: " + text);
    }

    @Override
    public String toString() {
        return value;
    }
}
