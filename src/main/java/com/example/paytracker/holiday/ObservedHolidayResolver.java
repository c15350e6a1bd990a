package com.example.paytracker.holiday;

import com.example.paytracker.schedule.WeeklySchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Applies the holiday slide rule.
 * <p>
 * A holiday on a scheduled workday is observed on its own date. A holiday on a Sunday RDO slides
 * forward to the next workday; on any other RDO it slides back to the previous workday.
 */
@Component
public class ObservedHolidayResolver {

    private static final Logger logger = LoggerFactory.getLogger(ObservedHolidayResolver.class);

    static final int MAX_SLIDE_DAYS = 14;

    public LocalDate resolve(LocalDate holidayDate, WeeklySchedule schedule) {
        if (schedule.isWorkday(holidayDate.getDayOfWeek())) {
            return holidayDate;
        }
        int direction = holidayDate.getDayOfWeek() == DayOfWeek.SUNDAY ? 1 : -1;
        for (int step = 1; step <= MAX_SLIDE_DAYS; step++) {
            LocalDate candidate = holidayDate.plusDays((long) step * direction);
            if (schedule.isWorkday(candidate.getDayOfWeek())) {
                return candidate;
            }
        }
        // no workday in the schedule at all
        logger.debug("No workday within {} days of holiday {}; observing it on its calendar date", MAX_SLIDE_DAYS, holidayDate);
        return holidayDate;
    }

    public boolean isObservedOn(LocalDate date, WeeklySchedule schedule, List<CalendarHoliday> holidays) {
        for (CalendarHoliday holiday : holidays) {
            if (date.equals(resolve(holiday.date(), schedule))) {
                return true;
            }
        }
        return false;
    }
}
