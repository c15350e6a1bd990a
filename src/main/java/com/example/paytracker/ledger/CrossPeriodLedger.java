package com.example.paytracker.ledger;

import com.example.paytracker.common.PayMath;
import com.example.paytracker.paycheck.ReferenceContext;
import com.example.paytracker.paycheck.ReferenceContextLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Running variance between what was paid and what should have been paid, period by period.
 * <p>
 * Periods are folded in period-end order whatever order they arrive in. Each audited period is
 * recomputed at the rates of its own statement, falling back to the current rates only when that
 * statement yields none.
 */
public class CrossPeriodLedger {

    private static final Logger logger = LoggerFactory.getLogger(CrossPeriodLedger.class);

    private static final BigDecimal THRESHOLD = BigDecimal.ONE;

    private static final Comparator<LedgerPeriod> CHRONOLOGICAL = Comparator
            .comparing(LedgerPeriod::periodEnding, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(LedgerPeriod::payDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(LedgerPeriod::paycheckId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));

    private final int maxPeriods;

    public CrossPeriodLedger(int maxPeriods) {
        this.maxPeriods = maxPeriods;
    }

    public List<LedgerRow> build(List<LedgerPeriod> periods,
                                 ReferenceContext currentReference,
                                 ReferenceContextLookup historicalLookup,
                                 ExpectedGrossSource expectedGrossSource) {
        List<LedgerPeriod> ordered = periods.stream().sorted(CHRONOLOGICAL).toList();
        if (ordered.size() > maxPeriods) {
            logger.warn("Ledger limited to the first {} of {} periods", maxPeriods, ordered.size());
            ordered = ordered.subList(0, maxPeriods);
        }

        List<LedgerRow> rows = new ArrayList<>(ordered.size());
        BigDecimal balance = PayMath.ZERO_MONEY;
        for (LedgerPeriod period : ordered) {
            BigDecimal actual = PayMath.orZero(period.declaredGross());
            BigDecimal expected;
            BigDecimal diff;
            LedgerStatus status;
            if (!period.audited()) {
                expected = actual;
                diff = PayMath.ZERO_MONEY;
                status = LedgerStatus.UNAUDITED;
            } else {
                ReferenceContext reference = historicalLookup.forPaycheck(period.paycheckId());
                if (!reference.hasRate()) {
                    reference = currentReference;
                }
                expected = PayMath.orZero(expectedGrossSource.expectedGross(period, reference));
                diff = actual.subtract(expected);
                status = statusOf(diff);
            }
            balance = balance.add(diff);
            rows.add(new LedgerRow(period.paycheckId(),
                    period.payDate(),
                    period.periodEnding(),
                    expected,
                    actual,
                    diff,
                    balance,
                    status));
        }
        return rows;
    }

    static LedgerStatus statusOf(BigDecimal diff) {
        if (diff.compareTo(THRESHOLD.negate()) < 0) {
            return LedgerStatus.GOV_OWES_YOU;
        }
        if (diff.compareTo(THRESHOLD) > 0) {
            return LedgerStatus.BACKPAY;
        }
        return LedgerStatus.BALANCED;
    }
}
