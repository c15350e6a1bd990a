package com.example.paytracker.timesheet;

import java.util.Locale;

/**
 * What covers the gap when fewer hours are worked than the schedule expects.
 */
public enum LeaveDesignation {
    NONE("None"),
    ANNUAL("Annual"),
    SICK("Sick"),
    HOLIDAY("Holiday"),
    CREDIT("Credit"),
    COMP("Comp"),
    LWOP("LWOP");

    private final String label;

    LeaveDesignation(String label) {
        this.label = label;
    }

    public boolean isDesignated() {
        return this != NONE;
    }

    /** Accepts the enum name or the display label in any case; blank means {@link #NONE}. */
    public static LeaveDesignation fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (LeaveDesignation designation : values()) {
            if (designation.name().equals(normalized) || designation.label.toUpperCase(Locale.ROOT).equals(normalized)) {
                return designation;
            }
        }
        throw new IllegalArgumentException("Unknown leave designation: " + value);
    }

    public static LeaveDesignation orNone(LeaveDesignation designation) {
        return designation == null ? NONE : designation;
    }
}
