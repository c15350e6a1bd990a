package com.example.paytracker.audit;

import com.example.paytracker.common.PayMath;
import com.example.paytracker.paycheck.DeclaredPaycheck;
import com.example.paytracker.paycheck.DeductionKind;
import com.example.paytracker.paycheck.DeductionLine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Share of gross pay withheld as Tax, OASDI or Medicare, as a percentage.
 */
@Component
public class EffectiveTaxRateCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public TaxRate calculate(DeclaredPaycheck paycheck) {
        BigDecimal totalTax = PayMath.ZERO_MONEY;
        for (DeductionLine line : paycheck.deductions()) {
            if (DeductionKind.isTax(line.type())) {
                totalTax = totalTax.add(PayMath.orZero(line.currentAmount()));
            }
        }
        BigDecimal gross = PayMath.orZero(paycheck.grossPay());
        BigDecimal percent = PayMath.isPositive(gross)
                ? totalTax.multiply(HUNDRED).divide(gross, 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(2);
        return new TaxRate(paycheck.id(), gross, totalTax, percent);
    }

    public record TaxRate(Long paycheckId, BigDecimal grossPay, BigDecimal totalTax, BigDecimal effectiveRatePercent) {}
}
