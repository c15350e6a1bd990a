package com.example.paytracker.ledger;

import com.example.paytracker.paycheck.ReferenceContext;
import com.example.paytracker.paycheck.ReferenceContextLookup;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CrossPeriodLedgerTest {

    private static final LedgerPeriod FIRST = new LedgerPeriod(1L, LocalDate.of(2025, 1, 17), LocalDate.of(2025, 1, 11),
            new BigDecimal("1800.00"), true);
    private static final LedgerPeriod SECOND = new LedgerPeriod(2L, LocalDate.of(2025, 1, 31), LocalDate.of(2025, 1, 25),
            new BigDecimal("2050.00"), true);

    /** Expected gross is 40 hours at whatever rate the ledger resolved. */
    private static final ExpectedGrossSource FORTY_HOURS = (period, reference) ->
            reference.baseRate().multiply(new BigDecimal("40"));

    private final ReferenceContext current = rate(99L, "50.00");
    private final ReferenceContextLookup ownRates = id -> rate(id, "50.00");

    @Test
    void runningBalanceFoldsDiffsInDateOrder() {
        List<LedgerRow> rows = new CrossPeriodLedger(520).build(List.of(FIRST, SECOND), current, ownRates, FORTY_HOURS);

        assertThat(rows).extracting(LedgerRow::paycheckId).containsExactly(1L, 2L);
        assertThat(rows.get(0).diff()).isEqualByComparingTo("-200.00");
        assertThat(rows.get(0).runningBalance()).isEqualByComparingTo("-200.00");
        assertThat(rows.get(0).status()).isEqualTo(LedgerStatus.GOV_OWES_YOU);
        assertThat(rows.get(1).diff()).isEqualByComparingTo("50.00");
        assertThat(rows.get(1).runningBalance()).isEqualByComparingTo("-150.00");
        assertThat(rows.get(1).status()).isEqualTo(LedgerStatus.BACKPAY);
    }

    @Test
    void inputOrderDoesNotChangeTheFold() {
        List<LedgerRow> inOrder = new CrossPeriodLedger(520).build(List.of(FIRST, SECOND), current, ownRates, FORTY_HOURS);
        List<LedgerRow> reversed = new CrossPeriodLedger(520).build(List.of(SECOND, FIRST), current, ownRates, FORTY_HOURS);

        assertThat(reversed).isEqualTo(inOrder);
    }

    @Test
    void unauditedPeriodContributesNothing() {
        LedgerPeriod unaudited = new LedgerPeriod(3L, LocalDate.of(2025, 1, 24), LocalDate.of(2025, 1, 18),
                new BigDecimal("12345.67"), false);

        List<LedgerRow> rows = new CrossPeriodLedger(520).build(List.of(SECOND, unaudited, FIRST), current, ownRates, FORTY_HOURS);

        LedgerRow middle = rows.get(1);
        assertThat(middle.paycheckId()).isEqualTo(3L);
        assertThat(middle.status()).isEqualTo(LedgerStatus.UNAUDITED);
        assertThat(middle.diff()).isEqualByComparingTo("0");
        assertThat(middle.expectedGross()).isEqualByComparingTo("12345.67");
        assertThat(middle.runningBalance()).isEqualByComparingTo("-200.00");
        assertThat(rows.get(2).runningBalance()).isEqualByComparingTo("-150.00");
    }

    @Test
    void eachPeriodIsRecomputedAtItsOwnRate() {
        Map<Long, ReferenceContext> historical = Map.of(
                1L, rate(1L, "45.00"),
                2L, ReferenceContext.missing());

        List<LedgerRow> rows = new CrossPeriodLedger(520).build(List.of(FIRST, SECOND), current, historical::get, FORTY_HOURS);

        assertThat(rows.get(0).expectedGross()).isEqualByComparingTo("1800.00");
        assertThat(rows.get(0).status()).isEqualTo(LedgerStatus.BALANCED);
        // no rate of its own: falls back to the current one
        assertThat(rows.get(1).expectedGross()).isEqualByComparingTo("2000.00");
    }

    @Test
    void smallDifferencesAreBalanced() {
        assertThat(CrossPeriodLedger.statusOf(new BigDecimal("1.00"))).isEqualTo(LedgerStatus.BALANCED);
        assertThat(CrossPeriodLedger.statusOf(new BigDecimal("-1.00"))).isEqualTo(LedgerStatus.BALANCED);
        assertThat(CrossPeriodLedger.statusOf(new BigDecimal("-1.01"))).isEqualTo(LedgerStatus.GOV_OWES_YOU);
        assertThat(CrossPeriodLedger.statusOf(new BigDecimal("1.01"))).isEqualTo(LedgerStatus.BACKPAY);
    }

    @Test
    void iterationCapStopsAfterTheOldestPeriods() {
        List<LedgerRow> rows = new CrossPeriodLedger(1).build(List.of(SECOND, FIRST), current, ownRates, FORTY_HOURS);

        assertThat(rows).extracting(LedgerRow::paycheckId).containsExactly(1L);
    }

    private static ReferenceContext rate(Long id, String baseRate) {
        return new ReferenceContext(id, new BigDecimal(baseRate), new BigDecimal("2000.00"), List.of(), List.of());
    }
}
