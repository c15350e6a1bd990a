package com.example.paytracker.timesheet;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayPeriodCalendarTest {

    private final PayPeriodCalendar calendar = new PayPeriodCalendar(LocalDate.of(2024, 12, 14));

    @Test
    void datesOf_listsFourteenDaysEndingOnPeriodEnd() {
        List<LocalDate> dates = PayPeriodCalendar.datesOf(LocalDate.of(2024, 12, 14));

        assertThat(dates).hasSize(14);
        assertThat(dates.get(0)).isEqualTo(LocalDate.of(2024, 12, 1));
        assertThat(dates.get(13)).isEqualTo(LocalDate.of(2024, 12, 14));
    }

    @Test
    void periodEndingFor_locatesPeriodsOnEitherSideOfTheAnchor() {
        assertThat(calendar.periodEndingFor(LocalDate.of(2024, 12, 14))).isEqualTo(LocalDate.of(2024, 12, 14));
        assertThat(calendar.periodEndingFor(LocalDate.of(2024, 12, 1))).isEqualTo(LocalDate.of(2024, 12, 14));
        assertThat(calendar.periodEndingFor(LocalDate.of(2024, 11, 30))).isEqualTo(LocalDate.of(2024, 11, 30));
        assertThat(calendar.periodEndingFor(LocalDate.of(2024, 12, 15))).isEqualTo(LocalDate.of(2024, 12, 28));
        assertThat(calendar.periodEndingFor(LocalDate.of(2025, 3, 3))).isEqualTo(LocalDate.of(2025, 3, 8));
    }

    @Test
    void isPeriodEnding_onlyForEveryFourteenthDay() {
        assertThat(calendar.isPeriodEnding(LocalDate.of(2025, 1, 11))).isTrue();
        assertThat(calendar.isPeriodEnding(LocalDate.of(2025, 1, 4))).isFalse();
    }
}
