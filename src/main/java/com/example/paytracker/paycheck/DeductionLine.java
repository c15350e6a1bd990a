package com.example.paytracker.paycheck;

import java.math.BigDecimal;

/**
 * @param ytdAmount year-to-date amount, or {@code null} when it cannot be derived
 */
public record DeductionLine(String type,
                            BigDecimal currentAmount,
                            BigDecimal adjustedAmount,
                            BigDecimal ytdAmount) {

    public DeductionKind kind() {
        return DeductionKind.classify(type);
    }
}
