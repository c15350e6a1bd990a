package com.example.paytracker.ledger;

import com.example.paytracker.config.PayRulesSettings;
import com.example.paytracker.holiday.HolidayLookup;
import com.example.paytracker.paycheck.DeclaredPaycheck;
import com.example.paytracker.paycheck.PaycheckService;
import com.example.paytracker.paycheck.PeriodPayCalculator;
import com.example.paytracker.paycheck.ReferenceContext;
import com.example.paytracker.paycheck.ReferenceContextProvider;
import com.example.paytracker.schedule.ScheduleLookup;
import com.example.paytracker.timesheet.ShiftEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@Transactional(readOnly = true)
public class LedgerService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerService.class);

    private final PaycheckService paycheckService;
    private final ReferenceContextProvider referenceProvider;
    private final ShiftEntryStore shiftEntryStore;
    private final ScheduleLookup scheduleLookup;
    private final HolidayLookup holidayLookup;
    private final PeriodPayCalculator calculator;
    private final PayRulesSettings settings;

    public LedgerService(PaycheckService paycheckService,
                         ReferenceContextProvider referenceProvider,
                         ShiftEntryStore shiftEntryStore,
                         ScheduleLookup scheduleLookup,
                         HolidayLookup holidayLookup,
                         PeriodPayCalculator calculator,
                         PayRulesSettings settings) {
        this.paycheckService = paycheckService;
        this.referenceProvider = referenceProvider;
        this.shiftEntryStore = shiftEntryStore;
        this.scheduleLookup = scheduleLookup;
        this.holidayLookup = holidayLookup;
        this.calculator = calculator;
        this.settings = settings;
    }

    public List<LedgerRow> ledger() {
        Map<Long, DeclaredPaycheck> declared = new HashMap<>();
        List<LedgerPeriod> periods = new ArrayList<>();
        for (DeclaredPaycheck paycheck : paycheckService.declaredInPayDateOrder()) {
            declared.put(paycheck.id(), paycheck);
            LocalDate periodEnding = paycheck.meta().periodEnding();
            periods.add(new LedgerPeriod(paycheck.id(),
                    paycheck.meta().payDate(),
                    periodEnding,
                    paycheck.grossPay(),
                    periodEnding != null && shiftEntryStore.hasSavedEntries(periodEnding)));
        }

        ExpectedGrossSource expectedGross = (period, reference) -> {
            DeclaredPaycheck paycheck = declared.get(period.paycheckId());
            return calculator.compute(shiftEntryStore.entriesFor(period.periodEnding()),
                            scheduleLookup,
                            holidayLookup,
                            reference,
                            paycheck.meta(),
                            paycheck.leave(),
                            settings.getPayRates())
                    .breakdown()
                    .grossPay();
        };

        ReferenceContext current = referenceProvider.latest();
        List<LedgerRow> rows = new CrossPeriodLedger(settings.getMaxLedgerPeriods())
                .build(periods, current, referenceProvider, expectedGross);
        if (!rows.isEmpty()) {
            logger.debug("Ledger built over {} period(s); balance {}", rows.size(), rows.get(rows.size() - 1).runningBalance());
        }
        return rows;
    }

    public static BigDecimal finalBalance(List<LedgerRow> rows) {
        return rows.isEmpty() ? BigDecimal.ZERO : rows.get(rows.size() - 1).runningBalance();
    }
}
