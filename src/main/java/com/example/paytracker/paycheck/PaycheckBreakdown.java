package com.example.paytracker.paycheck;

import java.math.BigDecimal;
import java.util.List;

/**
 * A synthesized pay statement.
 *
 * @param reliable false when no reference statement with a positive base rate existed, so every
 *                 amount is zero for lack of a rate rather than because nothing is owed
 */
public record PaycheckBreakdown(PeriodMeta meta,
                                List<EarningsLine> earnings,
                                List<DeductionLine> deductions,
                                List<LeaveLine> leave,
                                BigDecimal grossPay,
                                BigDecimal totalDeductions,
                                BigDecimal netPay,
                                String remarks,
                                boolean reliable) {

    public PaycheckBreakdown {
        earnings = List.copyOf(earnings);
        deductions = List.copyOf(deductions);
        leave = List.copyOf(leave);
    }
}
