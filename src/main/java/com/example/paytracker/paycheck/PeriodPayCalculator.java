package com.example.paytracker.paycheck;

import com.example.paytracker.holiday.CalendarHoliday;
import com.example.paytracker.holiday.HolidayLookup;
import com.example.paytracker.schedule.ScheduleLookup;
import com.example.paytracker.schedule.WeeklySchedule;
import com.example.paytracker.timesheet.DailyBreakdownEngine;
import com.example.paytracker.timesheet.DailyBucket;
import com.example.paytracker.timesheet.ShiftEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one period's shift entries through the daily breakdown and the synthesizer.
 * <p>
 * Schedules and holidays are read once per year per call and held only for that call, so every day of
 * the period sees the same snapshot. A date's holidays include the following year's calendar, which
 * lets a New Year's Day on a day off slide back into December.
 */
@Component
public class PeriodPayCalculator {

    private static final Logger logger = LoggerFactory.getLogger(PeriodPayCalculator.class);

    private final DailyBreakdownEngine breakdownEngine;
    private final PaycheckSynthesizer synthesizer;

    public PeriodPayCalculator(DailyBreakdownEngine breakdownEngine, PaycheckSynthesizer synthesizer) {
        this.breakdownEngine = breakdownEngine;
        this.synthesizer = synthesizer;
    }

    public PeriodComputation compute(List<ShiftEntry> entries,
                                     ScheduleLookup scheduleLookup,
                                     HolidayLookup holidayLookup,
                                     ReferenceContext reference,
                                     PeriodMeta meta,
                                     List<LeaveLine> referenceLeave,
                                     PayRates rates) {
        Map<Integer, WeeklySchedule> schedules = new HashMap<>();
        Map<Integer, List<CalendarHoliday>> holidaysByYear = new HashMap<>();

        List<DailyBucket> buckets = new ArrayList<>(entries.size());
        List<LocalDate> gapDates = new ArrayList<>();
        for (ShiftEntry entry : entries) {
            int year = entry.date().getYear();
            WeeklySchedule schedule = schedules.computeIfAbsent(year, scheduleLookup::forYear);
            List<CalendarHoliday> holidays = new ArrayList<>(holidaysByYear.computeIfAbsent(year, holidayLookup::forYear));
            holidays.addAll(holidaysByYear.computeIfAbsent(year + 1, holidayLookup::forYear));

            DailyBucket bucket = breakdownEngine.breakdown(entry, schedule, holidays);
            buckets.add(bucket);
            if (bucket.hasUncreditedGap()) {
                gapDates.add(bucket.date());
            }
        }
        if (!gapDates.isEmpty()) {
            logger.warn("Period {} has scheduled hours with no leave designation on {}",
                    meta == null ? null : meta.periodEnding(), gapDates);
        }

        PaycheckBreakdown breakdown = synthesizer.synthesize(buckets, reference, meta, referenceLeave, rates);
        return new PeriodComputation(buckets, breakdown, gapDates);
    }
}
