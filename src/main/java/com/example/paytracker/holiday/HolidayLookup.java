package com.example.paytracker.holiday;

import java.util.List;

@FunctionalInterface
public interface HolidayLookup {

    /** Holidays whose calendar date falls in {@code year}; never null. */
    List<CalendarHoliday> forYear(int year);
}
