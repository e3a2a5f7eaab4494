package com.reitracker.kpi;

import java.math.BigDecimal;

/**
 * Converts computed values into plain doubles safe for JSON output: null, NaN and infinite
 * values all become null.
 */
public final class NumberSanitizer {

    private NumberSanitizer() {}

    public static Double sanitize(BigDecimal value) {
        return value == null ? null : sanitize(value.doubleValue());
    }

    public static Double sanitize(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }
}
