package com.example.paytracker.holiday;

import java.time.LocalDate;

/**
 * A holiday as published on the calendar, before the slide rule moves it onto a workday.
 */
public record CalendarHoliday(int year, String name, LocalDate date) {

    public static CalendarHoliday of(String name, LocalDate date) {
        return new CalendarHoliday(date.getYear(), name, date);
    }
}
