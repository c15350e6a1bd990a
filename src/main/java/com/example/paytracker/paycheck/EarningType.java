package com.example.paytracker.paycheck;

import java.util.Locale;

/**
 * Earnings categories of the pay statement, in the order the statement prints them.
 * <p>
 * Declared statements name their lines inconsistently, so a declared line is classified by the first
 * category whose keyword occurs in its name. A renamed line silently falls into {@link #OTHER}.
 */
public enum EarningType {
    REGULAR("Regular / Holiday Leave", "regular"),
    INCENTIVE("Controller Incentive Pay", "incentive"),
    FLSA_PREMIUM("FLSA Premium", "flsa"),
    TRUE_OVERTIME("True Overtime", "overtime"),
    NIGHT("Night Differential", "night"),
    SUNDAY("Sunday Premium", "sunday"),
    HOLIDAY_WORKED("Holiday Worked", "holiday work"),
    OJTI("OJTI", "ojti"),
    CIC("CIC", "cic"),
    OTHER("Other", null);

    private final String label;
    private final String keyword;

    EarningType(String label, String keyword) {
        this.label = label;
        this.keyword = keyword;
    }

    public String getLabel() {
        return label;
    }

    public static EarningType classify(String lineName) {
        if (lineName == null) {
            return OTHER;
        }
        String normalized = lineName.toLowerCase(Locale.ROOT);
        for (EarningType type : values()) {
            if (type.keyword != null && normalized.contains(type.keyword)) {
                return type;
            }
        }
        return OTHER;
    }
}
