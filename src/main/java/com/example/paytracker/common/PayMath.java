package com.example.paytracker.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Legacy payroll arithmetic.
 * <p>
 * Hour sums are truncated to 4 decimal places and currency to whole cents, always toward zero.
 * Results must never be rounded half-up: the pay statements being reconciled were produced
 * with truncation and only reproduce exactly under it.
 */
public final class PayMath {

    public static final BigDecimal ZERO_HOURS = BigDecimal.ZERO.setScale(4);
    public static final BigDecimal ZERO_MONEY = BigDecimal.ZERO.setScale(2);
    public static final BigDecimal EIGHT_HOURS = new BigDecimal("8");
    public static final BigDecimal QUARTER_HOUR = new BigDecimal("0.25");

    private static final int HOUR_SCALE = 4;
    private static final int MONEY_SCALE = 2;
    private static final int WORKING_SCALE = 10;
    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private PayMath() {
    }

    public static BigDecimal truncateHours(BigDecimal hours) {
        return hours == null ? ZERO_HOURS : hours.setScale(HOUR_SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal truncateCents(BigDecimal amount) {
        return amount == null ? ZERO_MONEY : amount.setScale(MONEY_SCALE, RoundingMode.DOWN);
    }

    /** Exact for whole and quarter hours; otherwise truncated well below the hour scale. */
    public static BigDecimal hoursOfMinutes(long minutes) {
        return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 8, RoundingMode.DOWN);
    }

    public static BigDecimal quarters(long count) {
        return QUARTER_HOUR.multiply(BigDecimal.valueOf(count));
    }

    /**
     * {@code value * numerator / denominator}, multiplying first so that a ratio of equal
     * amounts reproduces the value exactly. Returns zero when the denominator is not positive.
     */
    public static BigDecimal scale(BigDecimal value, BigDecimal numerator, BigDecimal denominator) {
        if (value == null || numerator == null || !isPositive(denominator)) {
            return BigDecimal.ZERO;
        }
        return value.multiply(numerator).divide(denominator, WORKING_SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (!isPositive(divisor)) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, WORKING_SCALE, RoundingMode.DOWN);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
