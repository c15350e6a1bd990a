package com.example.paytracker.paycheck;

import java.math.BigDecimal;

/**
 * A leave balance row. Every figure is in hours.minutes notation: {@code 6.45} is six hours
 * forty-five minutes. See {@link LeaveClock}.
 */
public record LeaveLine(String type,
                        BigDecimal start,
                        BigDecimal earned,
                        BigDecimal used,
                        BigDecimal end) {
}
