package com.example.paytracker.paycheck;

import com.example.paytracker.common.PayMath;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Rates and deduction ratios taken from a real pay statement, used as the source of truth when
 * synthesizing an expected one.
 *
 * @param sourcePaycheckId statement the figures came from; {@code null} when no usable statement exists
 * @param referenceGross   gross pay of that statement, the denominator for percentage deductions
 */
public record ReferenceContext(Long sourcePaycheckId,
                               BigDecimal baseRate,
                               BigDecimal referenceGross,
                               List<EarningsLine> earnings,
                               List<DeductionLine> deductions) {

    public ReferenceContext {
        baseRate = PayMath.orZero(baseRate);
        referenceGross = PayMath.orZero(referenceGross);
        earnings = earnings == null ? List.of() : List.copyOf(earnings);
        deductions = deductions == null ? List.of() : List.copyOf(deductions);
    }

    /** No statement anywhere has a positive base rate. */
    public static ReferenceContext missing() {
        return new ReferenceContext(null, BigDecimal.ZERO, BigDecimal.ZERO, List.of(), List.of());
    }

    public static ReferenceContext of(DeclaredPaycheck paycheck, BigDecimal baseRate) {
        return new ReferenceContext(paycheck.id(), baseRate, paycheck.grossPay(), paycheck.earnings(), paycheck.deductions());
    }

    public boolean hasRate() {
        return PayMath.isPositive(baseRate);
    }

    public Optional<EarningsLine> firstEarning(EarningType category) {
        return earnings.stream().filter(line -> line.category() == category).findFirst();
    }
}
