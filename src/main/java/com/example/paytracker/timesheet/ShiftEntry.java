package com.example.paytracker.timesheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;

/**
 * What a worker reports for one calendar day: the actual shift times, if any, the leave covering
 * a short day, and supplemental hours by category.
 */
public record ShiftEntry(LocalDate date,
                         LocalTime startTime,
                         LocalTime endTime,
                         LeaveDesignation leaveDesignation,
                         Map<SupplementalCategory, BigDecimal> supplementalHours) {

    public ShiftEntry {
        leaveDesignation = LeaveDesignation.orNone(leaveDesignation);
        supplementalHours = SupplementalCategory.copyOf(supplementalHours);
    }

    public static ShiftEntry worked(LocalDate date, LocalTime start, LocalTime end) {
        return new ShiftEntry(date, start, end, LeaveDesignation.NONE, Map.of());
    }

    public static ShiftEntry leave(LocalDate date, LeaveDesignation designation) {
        return new ShiftEntry(date, null, null, designation, Map.of());
    }
}
