package com.example.paytracker.timesheet;

import com.example.paytracker.config.PayRulesSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Biweekly pay periods, located relative to one known period-end date.
 */
@Component
public class PayPeriodCalendar {

    public static final int PERIOD_DAYS = 14;

    private final LocalDate anchorPeriodEnding;

    @Autowired
    public PayPeriodCalendar(PayRulesSettings settings) {
        this(settings.getAnchorPeriodEnding());
    }

    public PayPeriodCalendar(LocalDate anchorPeriodEnding) {
        this.anchorPeriodEnding = anchorPeriodEnding;
    }

    /** The 14 dates of the period, oldest first. */
    public static List<LocalDate> datesOf(LocalDate periodEnding) {
        List<LocalDate> dates = new ArrayList<>(PERIOD_DAYS);
        LocalDate start = periodStart(periodEnding);
        for (int i = 0; i < PERIOD_DAYS; i++) {
            dates.add(start.plusDays(i));
        }
        return dates;
    }

    public static LocalDate periodStart(LocalDate periodEnding) {
        return periodEnding.minusDays(PERIOD_DAYS - 1);
    }

    public static boolean contains(LocalDate periodEnding, LocalDate date) {
        return !date.isBefore(periodStart(periodEnding)) && !date.isAfter(periodEnding);
    }

    /** End date of the period that contains {@code date}. */
    public LocalDate periodEndingFor(LocalDate date) {
        long diff = ChronoUnit.DAYS.between(anchorPeriodEnding, date);
        long remainder = Math.floorMod(diff, PERIOD_DAYS);
        return remainder == 0 ? date : date.plusDays(PERIOD_DAYS - remainder);
    }

    public boolean isPeriodEnding(LocalDate date) {
        return periodEndingFor(date).equals(date);
    }
}
