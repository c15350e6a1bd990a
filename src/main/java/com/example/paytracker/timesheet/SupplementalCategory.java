package com.example.paytracker.timesheet;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Hours logged on top of the shift itself that carry their own differential.
 */
public enum SupplementalCategory {
    /** On-the-job training instruction. */
    OJTI,
    /** Controller-in-charge. */
    CIC;

    /** Unmodifiable copy in declaration order, without null keys or values. */
    public static Map<SupplementalCategory, BigDecimal> copyOf(Map<SupplementalCategory, BigDecimal> hours) {
        EnumMap<SupplementalCategory, BigDecimal> copy = new EnumMap<>(SupplementalCategory.class);
        if (hours != null) {
            hours.forEach((category, value) -> {
                if (category != null && value != null) {
                    copy.put(category, value);
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }
}
