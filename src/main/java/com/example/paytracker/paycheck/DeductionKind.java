package com.example.paytracker.paycheck;

import java.util.List;
import java.util.Locale;

/**
 * Whether a deduction scales with gross pay or stays a fixed amount per period.
 * <p>
 * Classification is by keyword in the deduction name. A renamed tax or retirement line is treated as
 * fixed until its keyword is added here.
 */
public enum DeductionKind {
    PERCENTAGE,
    FIXED;

    static final List<String> PERCENTAGE_KEYWORDS = List.of("tax", "oasdi", "medicare", "fers", "retire", "tsp");
    static final List<String> TAX_KEYWORDS = List.of("tax", "oasdi", "medicare");

    public static DeductionKind classify(String deductionName) {
        return containsAny(deductionName, PERCENTAGE_KEYWORDS) ? PERCENTAGE : FIXED;
    }

    public static boolean isTax(String deductionName) {
        return containsAny(deductionName, TAX_KEYWORDS);
    }

    private static boolean containsAny(String name, List<String> keywords) {
        if (name == null) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(normalized::contains);
    }
}
