package com.example.paytracker.timesheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Hours of one calendar day sorted into pay categories.
 *
 * @param uncreditedGapHours scheduled hours that were neither worked nor covered by a leave
 *                           designation; the caller should ask the worker to resolve them
 */
public record DailyBucket(LocalDate date,
                          BigDecimal workedHours,
                          BigDecimal regularHours,
                          BigDecimal overtimeHours,
                          BigDecimal nightHours,
                          BigDecimal sundayHours,
                          BigDecimal holidayWorkedHours,
                          BigDecimal holidayLeaveHours,
                          BigDecimal chargedLeaveHours,
                          LeaveDesignation leaveDesignation,
                          Map<SupplementalCategory, BigDecimal> supplementalHours,
                          BigDecimal uncreditedGapHours,
                          boolean observedHoliday) {

    public DailyBucket {
        supplementalHours = SupplementalCategory.copyOf(supplementalHours);
    }

    public BigDecimal supplemental(SupplementalCategory category) {
        return supplementalHours.getOrDefault(category, BigDecimal.ZERO);
    }

    public boolean hasUncreditedGap() {
        return uncreditedGapHours != null && uncreditedGapHours.signum() > 0;
    }
}
