package com.example.paytracker.paycheck;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Leave balances are printed in hours.minutes notation: the fraction holds literal minutes, so
 * {@code 6.45} means 6h45m (405 minutes), not 6.75 hours.
 */
public final class LeaveClock {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private LeaveClock() {
    }

    public static long toMinutes(BigDecimal value) {
        if (value == null) {
            return 0;
        }
        long hours = value.longValue();
        long minutes = value.subtract(BigDecimal.valueOf(hours)).multiply(HUNDRED)
                .setScale(0, RoundingMode.HALF_UP).longValueExact();
        return hours * 60 + minutes;
    }

    /** Negative balances keep the sign outside the notation: -90 minutes is {@code -1.30}. */
    public static BigDecimal fromMinutes(long minutes) {
        long magnitude = Math.abs(minutes);
        BigDecimal value = BigDecimal.valueOf(magnitude / 60)
                .add(BigDecimal.valueOf(magnitude % 60, 2));
        return minutes < 0 ? value.negate() : value;
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        return fromMinutes(toMinutes(a) + toMinutes(b));
    }

    public static String format(long minutes) {
        return fromMinutes(minutes).toPlainString();
    }
}
