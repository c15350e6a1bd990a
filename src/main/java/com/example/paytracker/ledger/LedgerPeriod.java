package com.example.paytracker.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One declared statement as the ledger sees it.
 *
 * @param audited whether a timesheet was ever saved for the period
 */
public record LedgerPeriod(Long paycheckId,
                           LocalDate payDate,
                           LocalDate periodEnding,
                           BigDecimal declaredGross,
                           boolean audited) {
}
