package com.retailpos.pricing.util;

import java.math.BigDecimal;

public final class NumberParsing {

    private static final int MAX_INTEGER_DIGITS = 12;
    private static final int MAX_SCALE = 6;

    private NumberParsing() {
    }

    /**
     * Parses a free-text numeric cell. Anything that is not a number becomes zero so a badly
     * typed cell degrades one line instead of the whole bill.
     */
    public static BigDecimal parseOrZero(String text) {
        if (text == null || text.isBlank()) {
            return BigDecimal.ZERO;
        }
        BigDecimal value = parse(text);
        return value != null ? value : BigDecimal.ZERO;
    }

    // Optional numeric cell: blank or malformed means "not chosen"
    public static BigDecimal parseOrNull(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return parse(text);
    }

    // A comma is never read as a separator: "1,5" is malformed, not fifteen
    private static BigDecimal parse(String text) {
        BigDecimal value;
        try {
            value = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        if (value.scale() > MAX_SCALE || value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
            return null;
        }
        return value;
    }
}
