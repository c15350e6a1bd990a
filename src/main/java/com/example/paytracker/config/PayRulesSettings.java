package com.example.paytracker.config;

import com.example.paytracker.paycheck.PayRates;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Pay-rule constants read from {@code paytracker.*} properties.
 * Services read these once per request and hand them to the computation core as plain values.
 */
@Component
public class PayRulesSettings {

    private final PayRates payRates;
    private final LocalDate anchorPeriodEnding;
    private final int maxLedgerPeriods;

    public PayRulesSettings(
            @Value("${paytracker.rates.night:0.10}") String nightRate,
            @Value("${paytracker.rates.sunday:0.25}") String sundayRate,
            @Value("${paytracker.rates.ojti:0.25}") String ojtiRate,
            @Value("${paytracker.rates.cic:0.10}") String cicRate,
            @Value("${paytracker.period.anchor-ending:2024-12-14}") String anchorPeriodEnding,
            @Value("${paytracker.ledger.max-periods:520}") int maxLedgerPeriods) {
        this.payRates = new PayRates(
                new BigDecimal(nightRate.trim()),
                new BigDecimal(sundayRate.trim()),
                new BigDecimal(ojtiRate.trim()),
                new BigDecimal(cicRate.trim()));
        this.anchorPeriodEnding = LocalDate.parse(anchorPeriodEnding.trim());
        this.maxLedgerPeriods = maxLedgerPeriods > 0 ? maxLedgerPeriods : 520;
    }

    public PayRates getPayRates() { return payRates; }
    public LocalDate getAnchorPeriodEnding() { return anchorPeriodEnding; }
    public int getMaxLedgerPeriods() { return maxLedgerPeriods; }
}
