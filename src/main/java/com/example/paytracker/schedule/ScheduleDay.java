package com.example.paytracker.schedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;

/**
 * One weekday of a user's standard schedule. An end time at or before the start time is an
 * overnight shift ending the next morning.
 */
public record ScheduleDay(DayOfWeek dayOfWeek, boolean workday, LocalTime startTime, LocalTime endTime) {

    public static ScheduleDay rdo(DayOfWeek dayOfWeek) {
        return new ScheduleDay(dayOfWeek, false, null, null);
    }

    public static ScheduleDay shift(DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {
        return new ScheduleDay(dayOfWeek, true, startTime, endTime);
    }

    /** Expected worked minutes for the day; zero for an RDO or a workday without times. */
    public long standardMinutes() {
        if (!workday || startTime == null || endTime == null) {
            return 0;
        }
        long minutes = Duration.between(startTime, endTime).toMinutes();
        if (!endTime.isAfter(startTime)) {
            minutes += Duration.ofDays(1).toMinutes();
        }
        return minutes;
    }
}
