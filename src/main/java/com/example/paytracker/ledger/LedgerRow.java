package com.example.paytracker.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * @param diff           declared gross minus expected gross; negative means underpaid
 * @param runningBalance sum of {@code diff} over this and every earlier period
 */
public record LedgerRow(Long paycheckId,
                        LocalDate payDate,
                        LocalDate periodEnding,
                        BigDecimal expectedGross,
                        BigDecimal actualGross,
                        BigDecimal diff,
                        BigDecimal runningBalance,
                        LedgerStatus status) {
}
