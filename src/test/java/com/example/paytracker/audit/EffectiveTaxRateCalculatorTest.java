package com.example.paytracker.audit;

import com.example.paytracker.paycheck.DeclaredPaycheck;
import com.example.paytracker.paycheck.DeductionLine;
import com.example.paytracker.paycheck.PeriodMeta;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EffectiveTaxRateCalculatorTest {

    private final EffectiveTaxRateCalculator calculator = new EffectiveTaxRateCalculator();

    @Test
    void sumsTaxLikeDeductionsOnly() {
        EffectiveTaxRateCalculator.TaxRate rate = calculator.calculate(paycheck("4000.00", List.of(
                new DeductionLine("Federal Tax", new BigDecimal("400.00"), null, null),
                new DeductionLine("OASDI", new BigDecimal("248.00"), null, null),
                new DeductionLine("Medicare", new BigDecimal("58.00"), null, null),
                new DeductionLine("FEGLI", new BigDecimal("20.00"), null, null))));

        assertThat(rate.totalTax()).isEqualByComparingTo("706.00");
        assertThat(rate.effectiveRatePercent()).isEqualByComparingTo("17.65");
    }

    @Test
    void zeroGross_givesZeroRate() {
        EffectiveTaxRateCalculator.TaxRate rate = calculator.calculate(paycheck("0.00", List.of(
                new DeductionLine("Federal Tax", new BigDecimal("10.00"), null, null))));

        assertThat(rate.effectiveRatePercent()).isEqualByComparingTo("0");
    }

    private static DeclaredPaycheck paycheck(String gross, List<DeductionLine> deductions) {
        return new DeclaredPaycheck(7L, new PeriodMeta(LocalDate.of(2025, 3, 14), LocalDate.of(2025, 3, 8), "FAA"),
                new BigDecimal(gross), null, null, null, List.of(), deductions, List.of());
    }
}
