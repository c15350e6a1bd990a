package com.example.paytracker.paycheck;

import com.example.paytracker.timesheet.DailyBucket;

import java.time.LocalDate;
import java.util.List;

/**
 * @param uncreditedGapDates scheduled days with hours neither worked nor covered by leave
 */
public record PeriodComputation(List<DailyBucket> buckets,
                                PaycheckBreakdown breakdown,
                                List<LocalDate> uncreditedGapDates) {

    public PeriodComputation {
        buckets = List.copyOf(buckets);
        uncreditedGapDates = List.copyOf(uncreditedGapDates);
    }
}
