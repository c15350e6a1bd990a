package com.example.paytracker.paycheck;

import java.math.BigDecimal;

/**
 * @param ytdAmount year-to-date amount, or {@code null} when it cannot be derived
 */
public record EarningsLine(String type,
                           BigDecimal rate,
                           BigDecimal hours,
                           BigDecimal currentAmount,
                           BigDecimal adjustedAmount,
                           BigDecimal ytdAmount) {

    public EarningType category() {
        return EarningType.classify(type);
    }
}
