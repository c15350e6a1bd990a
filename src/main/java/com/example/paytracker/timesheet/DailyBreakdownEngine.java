package com.example.paytracker.timesheet;

import com.example.paytracker.common.PayMath;
import com.example.paytracker.holiday.CalendarHoliday;
import com.example.paytracker.holiday.ObservedHolidayResolver;
import com.example.paytracker.schedule.ScheduleDay;
import com.example.paytracker.schedule.WeeklySchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sorts one day's actual shift into pay-category hours.
 * <ul>
 *   <li>Night hours: every quarter hour starting at or after 18:00 or before 06:00.</li>
 *   <li>Sunday premium on a scheduled day (touch rule): up to 8 hours once the shift starts or ends on a Sunday.</li>
 *   <li>Sunday premium on a day off (calendar rule): only the quarter hours that fall on Sunday.</li>
 *   <li>Scheduled hours not worked are credited as holiday leave, charged to the given leave
 *       designation, or left as an uncredited gap.</li>
 * </ul>
 */
@Component
public class DailyBreakdownEngine {

    private static final Logger logger = LoggerFactory.getLogger(DailyBreakdownEngine.class);

    private static final int QUARTER_MINUTES = 15;
    private static final int NIGHT_STARTS_AT = 18;
    private static final int NIGHT_ENDS_AT = 6;
    /** Shifts starting this late and ending "earlier" are taken to have started the evening before. */
    private static final int LATE_START_HOUR = 19;

    private final ObservedHolidayResolver holidayResolver;

    public DailyBreakdownEngine(ObservedHolidayResolver holidayResolver) {
        this.holidayResolver = holidayResolver;
    }

    public DailyBucket breakdown(ShiftEntry entry, WeeklySchedule schedule, List<CalendarHoliday> holidays) {
        return breakdown(entry.date(), entry.startTime(), entry.endTime(), entry.leaveDesignation(),
                entry.supplementalHours(), schedule, holidays);
    }

    public DailyBucket breakdown(LocalDate date,
                                 LocalTime actualStart,
                                 LocalTime actualEnd,
                                 LeaveDesignation leaveDesignation,
                                 Map<SupplementalCategory, BigDecimal> supplementalHours,
                                 WeeklySchedule schedule,
                                 List<CalendarHoliday> holidays) {
        LeaveDesignation leave = LeaveDesignation.orNone(leaveDesignation);
        Optional<ScheduleDay> scheduled = schedule.day(date.getDayOfWeek());
        if (scheduled.isEmpty()) {
            logger.debug("No schedule entry for {} ({}); treating it as a non-workday", date, date.getDayOfWeek());
        }
        boolean workday = scheduled.map(ScheduleDay::workday).orElse(false);
        long standardMinutes = scheduled.map(ScheduleDay::standardMinutes).orElse(0L);
        boolean observedHoliday = holidayResolver.isObservedOn(date, schedule, holidays);

        long workedMinutes = 0;
        BigDecimal nightHours = BigDecimal.ZERO;
        BigDecimal sundayHours = BigDecimal.ZERO;

        if (actualStart != null && actualEnd != null && !actualStart.equals(actualEnd)) {
            LocalDateTime start = date.atTime(actualStart);
            LocalDateTime end = date.atTime(actualEnd);
            if (!end.isAfter(start)) {
                if (actualStart.getHour() >= LATE_START_HOUR) {
                    start = start.minusDays(1);
                } else {
                    end = end.plusDays(1);
                }
                logger.debug("Shift {}-{} on {} crosses midnight; resolved to {} - {}", actualStart, actualEnd, date, start, end);
            }
            workedMinutes = Duration.between(start, end).toMinutes();
            QuarterCounts quarters = countQuarters(start, end);
            nightHours = PayMath.quarters(quarters.night());

            BigDecimal worked = PayMath.hoursOfMinutes(workedMinutes);
            if (workday) {
                if (start.getDayOfWeek() == DayOfWeek.SUNDAY || end.getDayOfWeek() == DayOfWeek.SUNDAY) {
                    sundayHours = worked.min(PayMath.EIGHT_HOURS);
                }
            } else {
                sundayHours = PayMath.quarters(quarters.sunday());
            }
        }

        BigDecimal workedHours = PayMath.hoursOfMinutes(workedMinutes);

        BigDecimal holidayLeaveHours = BigDecimal.ZERO;
        BigDecimal chargedLeaveHours = BigDecimal.ZERO;
        BigDecimal uncreditedGapHours = BigDecimal.ZERO;
        if (workday) {
            long gapMinutes = Math.max(0, standardMinutes - workedMinutes);
            if (gapMinutes > 0) {
                BigDecimal gap = PayMath.hoursOfMinutes(gapMinutes);
                if (leave == LeaveDesignation.HOLIDAY || observedHoliday) {
                    holidayLeaveHours = gap;
                } else if (leave.isDesignated()) {
                    chargedLeaveHours = gap;
                } else {
                    uncreditedGapHours = gap;
                    logger.debug("{} has {}h of scheduled time with no leave designation", date, gap);
                }
            }
        }

        BigDecimal regularHours;
        BigDecimal overtimeHours;
        if (workday) {
            regularHours = workedHours.min(PayMath.EIGHT_HOURS);
            overtimeHours = workedHours.subtract(PayMath.EIGHT_HOURS).max(BigDecimal.ZERO);
        } else {
            regularHours = BigDecimal.ZERO;
            overtimeHours = workedHours;
        }

        BigDecimal holidayWorkedHours = BigDecimal.ZERO;
        if (observedHoliday && workedMinutes > 0) {
            holidayWorkedHours = workedHours.min(PayMath.EIGHT_HOURS);
        }

        return new DailyBucket(date,
                workedHours,
                regularHours,
                overtimeHours,
                nightHours,
                sundayHours,
                holidayWorkedHours,
                holidayLeaveHours,
                chargedLeaveHours,
                leave,
                supplementalHours,
                uncreditedGapHours,
                observedHoliday);
    }

    private QuarterCounts countQuarters(LocalDateTime start, LocalDateTime end) {
        long night = 0;
        long sunday = 0;
        for (LocalDateTime cursor = start; cursor.isBefore(end); cursor = cursor.plusMinutes(QUARTER_MINUTES)) {
            int hour = cursor.getHour();
            if (hour >= NIGHT_STARTS_AT || hour < NIGHT_ENDS_AT) {
                night++;
            }
            if (cursor.getDayOfWeek() == DayOfWeek.SUNDAY) {
                sunday++;
            }
        }
        return new QuarterCounts(night, sunday);
    }

    private record QuarterCounts(long night, long sunday) {}
}
