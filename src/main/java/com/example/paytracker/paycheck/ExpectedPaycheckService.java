package com.example.paytracker.paycheck;

import com.example.paytracker.config.PayRulesSettings;
import com.example.paytracker.exception.BusinessException;
import com.example.paytracker.holiday.HolidayLookup;
import com.example.paytracker.schedule.ScheduleLookup;
import com.example.paytracker.timesheet.DailyBucket;
import com.example.paytracker.timesheet.ShiftEntry;
import com.example.paytracker.timesheet.ShiftEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
@Transactional(readOnly = true)
public class ExpectedPaycheckService {

    private static final Logger logger = LoggerFactory.getLogger(ExpectedPaycheckService.class);

    private final PaycheckService paycheckService;
    private final ReferenceContextLookup referenceLookup;
    private final ShiftEntryStore shiftEntryStore;
    private final ScheduleLookup scheduleLookup;
    private final HolidayLookup holidayLookup;
    private final PeriodPayCalculator calculator;
    private final PayRulesSettings settings;

    public ExpectedPaycheckService(PaycheckService paycheckService,
                                   ReferenceContextLookup referenceLookup,
                                   ShiftEntryStore shiftEntryStore,
                                   ScheduleLookup scheduleLookup,
                                   HolidayLookup holidayLookup,
                                   PeriodPayCalculator calculator,
                                   PayRulesSettings settings) {
        this.paycheckService = paycheckService;
        this.referenceLookup = referenceLookup;
        this.shiftEntryStore = shiftEntryStore;
        this.scheduleLookup = scheduleLookup;
        this.holidayLookup = holidayLookup;
        this.calculator = calculator;
        this.settings = settings;
    }

    /**
     * What the statement should have paid, given the period's timesheet (schedule defaults for days never
     * saved) and the rates in force for it.
     */
    public ExpectedPaycheck expectedFor(Long paycheckId) {
        DeclaredPaycheck declared = paycheckService.declared(paycheckId);
        LocalDate periodEnding = declared.meta().periodEnding();
        if (periodEnding == null) {
            throw new BusinessException("INVALID_PAYCHECK",
                    "Paycheck " + paycheckId + " has no period ending date", paycheckId);
        }
        List<ShiftEntry> entries = shiftEntryStore.entriesFor(periodEnding);
        ReferenceContext reference = referenceLookup.forPaycheck(paycheckId);

        PeriodComputation computation = calculator.compute(entries, scheduleLookup, holidayLookup, reference,
                declared.meta(), declared.leave(), settings.getPayRates());
        logger.debug("Expected gross for paycheck {} (period {}): {} declared, {} expected",
                paycheckId, periodEnding, declared.grossPay(), computation.breakdown().grossPay());
        return new ExpectedPaycheck(paycheckId,
                periodEnding,
                shiftEntryStore.hasSavedEntries(periodEnding),
                reference.sourcePaycheckId(),
                computation.breakdown(),
                computation.buckets(),
                computation.uncreditedGapDates());
    }

    /**
     * @param timesheetSaved       false when every day came from the standard schedule
     * @param referencePaycheckId  statement the rates were taken from
     */
    public record ExpectedPaycheck(Long paycheckId,
                                   LocalDate periodEnding,
                                   boolean timesheetSaved,
                                   Long referencePaycheckId,
                                   PaycheckBreakdown breakdown,
                                   List<DailyBucket> days,
                                   List<LocalDate> uncreditedGapDates) {}
}
