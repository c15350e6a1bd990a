package com.example.paytracker.schedule;

/**
 * Supplies the standard schedule in force for a calendar year.
 */
@FunctionalInterface
public interface ScheduleLookup {

    /** Never null; a year nobody configured yields {@link WeeklySchedule#empty()}. */
    WeeklySchedule forYear(int year);
}
