package com.example.paytracker.ledger;

import com.example.paytracker.paycheck.ReferenceContext;

import java.math.BigDecimal;

@FunctionalInterface
public interface ExpectedGrossSource {

    /** Gross the period's saved timesheet should have paid at the given rates. */
    BigDecimal expectedGross(LedgerPeriod period, ReferenceContext reference);
}
