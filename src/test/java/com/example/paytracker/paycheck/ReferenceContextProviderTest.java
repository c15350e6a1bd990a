package com.example.paytracker.paycheck;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Transactional
class ReferenceContextProviderTest {

    @Autowired
    private ReferenceContextProvider provider;

    @Autowired
    private PaycheckService paycheckService;

    @Test
    void statementWithOwnRate_isItsOwnReference() {
        Long id = register(LocalDate.of(2025, 1, 17), "48.00");

        ReferenceContext context = provider.forPaycheck(id);

        assertThat(context.sourcePaycheckId()).isEqualTo(id);
        assertThat(context.baseRate()).isEqualByComparingTo("48.00");
        assertThat(context.referenceGross()).isEqualByComparingTo("3840.00");
    }

    @Test
    void zeroRateStatement_borrowsFromMostRecentEarlierOne() {
        register(LocalDate.of(2025, 1, 17), "48.00");
        Long february = register(LocalDate.of(2025, 2, 14), "50.00");
        Long lapse = register(LocalDate.of(2025, 3, 14), "0.00");
        register(LocalDate.of(2025, 4, 11), "52.00");

        ReferenceContext context = provider.forPaycheck(lapse);

        assertThat(context.sourcePaycheckId()).isEqualTo(february);
        assertThat(context.baseRate()).isEqualByComparingTo("50.00");
    }

    @Test
    void zeroRateStatementWithNothingEarlier_usesLatestOverall() {
        Long lapse = register(LocalDate.of(2025, 1, 3), "0.00");
        register(LocalDate.of(2025, 1, 17), "48.00");
        Long latest = register(LocalDate.of(2025, 2, 14), "50.00");

        assertThat(provider.forPaycheck(lapse).sourcePaycheckId()).isEqualTo(latest);
        assertThat(provider.latest().sourcePaycheckId()).isEqualTo(latest);
    }

    @Test
    void noRateAnywhere_isMissing() {
        Long lapse = register(LocalDate.of(2025, 1, 3), "0.00");

        ReferenceContext context = provider.forPaycheck(lapse);

        assertThat(context.hasRate()).isFalse();
        assertThat(context.sourcePaycheckId()).isNull();
    }

    private Long register(LocalDate payDate, String rate) {
        BigDecimal gross = new BigDecimal(rate).multiply(new BigDecimal("80"));
        EarningsLine regular = new EarningsLine("Regular", new BigDecimal(rate), new BigDecimal("80"), gross, null, null);
        return paycheckService.register(new PaycheckService.PaycheckDraft(payDate, payDate.minusDays(6), "FAA",
                gross, BigDecimal.ZERO, gross, null, List.of(regular), List.of(), List.of())).id();
    }
}
