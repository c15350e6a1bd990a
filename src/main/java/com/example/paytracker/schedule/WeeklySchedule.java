package com.example.paytracker.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a year's standard schedule, at most one {@link ScheduleDay} per weekday.
 * A weekday without an entry reads as a non-workday with no expected hours.
 */
public final class WeeklySchedule {

    private static final WeeklySchedule EMPTY = new WeeklySchedule(new EnumMap<>(DayOfWeek.class));

    private final Map<DayOfWeek, ScheduleDay> days;

    private WeeklySchedule(EnumMap<DayOfWeek, ScheduleDay> days) {
        this.days = Collections.unmodifiableMap(days);
    }

    public static WeeklySchedule empty() {
        return EMPTY;
    }

    /** Later entries for the same weekday replace earlier ones. */
    public static WeeklySchedule of(Collection<ScheduleDay> entries) {
        EnumMap<DayOfWeek, ScheduleDay> byDay = new EnumMap<>(DayOfWeek.class);
        for (ScheduleDay entry : entries) {
            if (entry != null && entry.dayOfWeek() != null) {
                byDay.put(entry.dayOfWeek(), entry);
            }
        }
        return new WeeklySchedule(byDay);
    }

    /** Monday to Friday on the given hours, weekends off. */
    public static WeeklySchedule mondayToFriday(LocalTime start, LocalTime end) {
        EnumMap<DayOfWeek, ScheduleDay> byDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
            byDay.put(day, weekend ? ScheduleDay.rdo(day) : ScheduleDay.shift(day, start, end));
        }
        return new WeeklySchedule(byDay);
    }

    public Optional<ScheduleDay> day(DayOfWeek dayOfWeek) {
        return Optional.ofNullable(days.get(dayOfWeek));
    }

    public boolean isWorkday(DayOfWeek dayOfWeek) {
        ScheduleDay day = days.get(dayOfWeek);
        return day != null && day.workday();
    }
}
