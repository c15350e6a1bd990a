package com.example.paytracker.paycheck;

import com.example.paytracker.common.PayMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the pay statement whose rates and deduction ratios stand in for a period.
 * <p>
 * A statement with no positive regular rate (a lapse in appropriations pays nothing) borrows from the
 * most recent statement paid before it that has one, then from the most recent such statement overall.
 */
@Service
@Transactional(readOnly = true)
public class ReferenceContextProvider implements ReferenceContextLookup {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceContextProvider.class);

    private final PaycheckService paycheckService;

    public ReferenceContextProvider(PaycheckService paycheckService) {
        this.paycheckService = paycheckService;
    }

    @Override
    public ReferenceContext forPaycheck(Long paycheckId) {
        if (paycheckId == null) {
            return latest();
        }
        DeclaredPaycheck requested = paycheckService.declared(paycheckId);
        Optional<BigDecimal> ownRate = regularRate(requested);
        if (ownRate.isPresent()) {
            return ReferenceContext.of(requested, ownRate.get());
        }

        List<DeclaredPaycheck> newestFirst = newestFirst();
        Optional<ReferenceContext> earlier = newestFirst.stream()
                .filter(p -> p.meta().payDate().isBefore(requested.meta().payDate()))
                .filter(p -> regularRate(p).isPresent())
                .findFirst()
                .map(p -> ReferenceContext.of(p, regularRate(p).get()));
        if (earlier.isPresent()) {
            logger.info("Paycheck {} has no regular rate; using rates from paycheck {}",
                    paycheckId, earlier.get().sourcePaycheckId());
            return earlier.get();
        }
        ReferenceContext fallback = firstWithRate(newestFirst);
        if (fallback.hasRate()) {
            logger.info("Paycheck {} has no regular rate and nothing earlier does; using paycheck {}",
                    paycheckId, fallback.sourcePaycheckId());
        }
        return fallback;
    }

    /** Rates of the most recent statement that has a positive regular rate. */
    public ReferenceContext latest() {
        return firstWithRate(newestFirst());
    }

    private ReferenceContext firstWithRate(List<DeclaredPaycheck> newestFirst) {
        for (DeclaredPaycheck paycheck : newestFirst) {
            Optional<BigDecimal> rate = regularRate(paycheck);
            if (rate.isPresent()) {
                return ReferenceContext.of(paycheck, rate.get());
            }
        }
        logger.warn("No paycheck on record has a positive regular rate");
        return ReferenceContext.missing();
    }

    private List<DeclaredPaycheck> newestFirst() {
        return paycheckService.declaredInPayDateOrder().stream()
                .sorted(Comparator.comparing((DeclaredPaycheck p) -> p.meta().payDate()).reversed())
                .toList();
    }

    static Optional<BigDecimal> regularRate(DeclaredPaycheck paycheck) {
        return paycheck.earnings().stream()
                .filter(line -> line.category() == EarningType.REGULAR)
                .findFirst()
                .map(EarningsLine::rate)
                .filter(PayMath::isPositive);
    }
}
