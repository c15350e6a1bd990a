package com.example.paytracker.paycheck;

import com.example.paytracker.timesheet.SupplementalCategory;

import java.math.BigDecimal;

/**
 * Differential percentages of the base hourly rate.
 */
public record PayRates(BigDecimal night, BigDecimal sunday, BigDecimal ojti, BigDecimal cic) {

    public static PayRates standard() {
        return new PayRates(new BigDecimal("0.10"), new BigDecimal("0.25"), new BigDecimal("0.25"), new BigDecimal("0.10"));
    }

    public BigDecimal rateFor(SupplementalCategory category) {
        return switch (category) {
            case OJTI -> ojti;
            case CIC -> cic;
        };
    }
}
