package com.example.paytracker.holiday;

import com.example.paytracker.schedule.ScheduleDay;
import com.example.paytracker.schedule.WeeklySchedule;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ObservedHolidayResolverTest {

    private final ObservedHolidayResolver resolver = new ObservedHolidayResolver();
    private final WeeklySchedule weekdays = WeeklySchedule.mondayToFriday(LocalTime.of(6, 0), LocalTime.of(14, 0));

    @Test
    void holidayOnWorkday_isObservedOnItsDate() {
        LocalDate newYear = LocalDate.of(2025, 1, 1); // Wednesday
        assertThat(resolver.resolve(newYear, weekdays)).isEqualTo(newYear);
    }

    @Test
    void saturdayHoliday_slidesBackToFriday() {
        LocalDate independenceDay = LocalDate.of(2026, 7, 4); // Saturday
        assertThat(resolver.resolve(independenceDay, weekdays)).isEqualTo(LocalDate.of(2026, 7, 3));
    }

    @Test
    void sundayHoliday_slidesForwardToMonday() {
        LocalDate newYear = LocalDate.of(2023, 1, 1); // Sunday
        assertThat(resolver.resolve(newYear, weekdays)).isEqualTo(LocalDate.of(2023, 1, 2));
    }

    @Test
    void slideSkipsConsecutiveDaysOff() {
        // Wednesday to Sunday shifts; Monday and Tuesday off
        List<ScheduleDay> days = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean off = day == DayOfWeek.MONDAY || day == DayOfWeek.TUESDAY;
            days.add(off ? ScheduleDay.rdo(day) : ScheduleDay.shift(day, LocalTime.of(14, 0), LocalTime.of(22, 0)));
        }
        WeeklySchedule schedule = WeeklySchedule.of(days);

        LocalDate tuesday = LocalDate.of(2025, 1, 7);
        assertThat(resolver.resolve(tuesday, schedule)).isEqualTo(LocalDate.of(2025, 1, 5));
    }

    @Test
    void sundayHolidayWithMondayOff_slidesToTuesday() {
        List<ScheduleDay> days = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean off = day == DayOfWeek.SUNDAY || day == DayOfWeek.MONDAY;
            days.add(off ? ScheduleDay.rdo(day) : ScheduleDay.shift(day, LocalTime.of(6, 0), LocalTime.of(14, 0)));
        }
        LocalDate sunday = LocalDate.of(2025, 1, 5);
        assertThat(resolver.resolve(sunday, WeeklySchedule.of(days))).isEqualTo(LocalDate.of(2025, 1, 7));
    }

    @Test
    void scheduleWithoutWorkdays_keepsCalendarDate() {
        LocalDate saturday = LocalDate.of(2026, 7, 4);
        assertThat(resolver.resolve(saturday, WeeklySchedule.empty())).isEqualTo(saturday);
    }

    @Test
    void isObservedOn_matchesSlidDateOnly() {
        List<CalendarHoliday> holidays = List.of(CalendarHoliday.of("Independence Day", LocalDate.of(2026, 7, 4)));

        assertThat(resolver.isObservedOn(LocalDate.of(2026, 7, 3), weekdays, holidays)).isTrue();
        assertThat(resolver.isObservedOn(LocalDate.of(2026, 7, 4), weekdays, holidays)).isFalse();
    }
}
