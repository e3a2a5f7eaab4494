package com.reitracker.domain.vo;

import com.reitracker.exception.FieldValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared decimal arithmetic for money and percentage fields.
 *
 * <p>All intermediate math runs at {@link MathContext#DECIMAL128} so that level-payment
 * factors over 360 periods keep full precision; rounding to cents only happens when a
 * value is published in a report.
 */
public final class Amounts {

    public static final MathContext MC = MathContext.DECIMAL128;
    public static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {}

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static BigDecimal orZero(Integer value) {
        return value != null ? BigDecimal.valueOf(value) : BigDecimal.ZERO;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /** {@code base * percentage / 100}, treating a null percentage as 0. */
    public static BigDecimal percentOf(BigDecimal base, BigDecimal percentage) {
        if (percentage == null || base == null) {
            return BigDecimal.ZERO;
        }
        return base.multiply(percentage, MC).divide(HUNDRED, MC);
    }

    /** Annual figure spread over twelve months, null treated as 0. */
    public static BigDecimal monthly(BigDecimal annual) {
        return orZero(annual).divide(TWELVE, MC);
    }

    public static BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, MC);
    }

    public static BigDecimal cents(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }

    /** Fails with a field-named error unless {@code 0 <= value <= 100}; null passes. */
    public static void requirePercentage(BigDecimal value, String field) {
        if (value != null && (value.signum() < 0 || value.compareTo(HUNDRED) > 0)) {
            throw new FieldValidationException(field, "must be between 0 and 100");
        }
    }

    /** Fails with a field-named error if the value is negative; null passes. */
    public static void requireNonNegative(BigDecimal value, String field) {
        if (value != null && value.signum() < 0) {
            throw new FieldValidationException(field, "must not be negative");
        }
    }
}
