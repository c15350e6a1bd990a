package com.example.paytracker.paycheck;

import java.math.BigDecimal;
import java.util.List;

/**
 * A pay statement exactly as the payroll office issued it.
 */
public record DeclaredPaycheck(Long id,
                               PeriodMeta meta,
                               BigDecimal grossPay,
                               BigDecimal totalDeductions,
                               BigDecimal netPay,
                               String remarks,
                               List<EarningsLine> earnings,
                               List<DeductionLine> deductions,
                               List<LeaveLine> leave) {

    public DeclaredPaycheck {
        earnings = earnings == null ? List.of() : List.copyOf(earnings);
        deductions = deductions == null ? List.of() : List.copyOf(deductions);
        leave = leave == null ? List.of() : List.copyOf(leave);
    }
}
