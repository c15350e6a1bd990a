package com.example.paytracker.paycheck;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EarningTypeTest {

    @Test
    void classify_readsDeclaredLineNames() {
        assertThat(EarningType.classify("Regular")).isEqualTo(EarningType.REGULAR);
        assertThat(EarningType.classify("Regular / Holiday Leave")).isEqualTo(EarningType.REGULAR);
        assertThat(EarningType.classify("Holiday Worked")).isEqualTo(EarningType.HOLIDAY_WORKED);
        assertThat(EarningType.classify("FLSA Premium")).isEqualTo(EarningType.FLSA_PREMIUM);
        assertThat(EarningType.classify(null)).isEqualTo(EarningType.OTHER);
    }

    @Test
    void classify_holidayLeaveIsNotHolidayWorked() {
        assertThat(EarningType.classify("Holiday Leave")).isNotEqualTo(EarningType.HOLIDAY_WORKED);
    }
}
