package com.example.paytracker.paycheck;

import com.example.paytracker.common.PayMath;
import com.example.paytracker.timesheet.DailyBucket;
import com.example.paytracker.timesheet.SupplementalCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.example.paytracker.common.PayMath.truncateCents;
import static com.example.paytracker.common.PayMath.truncateHours;

/**
 * Builds the pay statement a period's hours should have produced.
 * <p>
 * Hour totals are truncated to 4 decimals and every amount and rate to whole cents before it feeds the
 * next step. Overtime carries an FLSA premium of half the regular rate of pay, where the regular rate is
 * all straight-time remuneration (differentials and incentive pay included) over all hours worked.
 */
@Component
public class PaycheckSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(PaycheckSynthesizer.class);

    static final String REMARKS = "GENERATED\nWeighted Avg FLSA";
    static final String UNRELIABLE_REMARK = "UNRELIABLE: no pay statement on record has a positive base rate";
    static final List<String> PROJECTED_LEAVE_TYPES = List.of("annual", "sick", "credit");

    private static final BigDecimal HALF = new BigDecimal("0.5");

    /**
     * Synthesizes from loose reference figures. Percentage deductions are then scaled against the sum of
     * the reference earnings.
     */
    public PaycheckBreakdown synthesize(List<DailyBucket> buckets,
                                        BigDecimal baseRate,
                                        List<EarningsLine> referenceEarnings,
                                        List<DeductionLine> referenceDeductions,
                                        PeriodMeta meta,
                                        List<LeaveLine> referenceLeave) {
        ReferenceContext reference = new ReferenceContext(null, baseRate, null, referenceEarnings, referenceDeductions);
        return synthesize(buckets, reference, meta, referenceLeave, PayRates.standard());
    }

    public PaycheckBreakdown synthesize(List<DailyBucket> buckets,
                                        ReferenceContext reference,
                                        PeriodMeta meta,
                                        List<LeaveLine> referenceLeave) {
        return synthesize(buckets, reference, meta, referenceLeave, PayRates.standard());
    }

    public PaycheckBreakdown synthesize(List<DailyBucket> buckets,
                                        ReferenceContext reference,
                                        PeriodMeta meta,
                                        List<LeaveLine> referenceLeave,
                                        PayRates rates) {
        if (!reference.hasRate()) {
            logger.warn("Synthesizing period {} without a base rate; result is flagged unreliable",
                    meta == null ? null : meta.periodEnding());
        }
        BigDecimal baseRate = reference.baseRate();

        BigDecimal regular = total(buckets, DailyBucket::regularHours);
        BigDecimal overtime = total(buckets, DailyBucket::overtimeHours);
        BigDecimal night = total(buckets, DailyBucket::nightHours);
        BigDecimal sunday = total(buckets, DailyBucket::sundayHours);
        BigDecimal holidayWorked = total(buckets, DailyBucket::holidayWorkedHours);
        BigDecimal holidayLeave = total(buckets, DailyBucket::holidayLeaveHours);
        Map<SupplementalCategory, BigDecimal> supplementalHours = new EnumMap<>(SupplementalCategory.class);
        for (SupplementalCategory category : SupplementalCategory.values()) {
            supplementalHours.put(category, total(buckets, b -> b.supplemental(category)));
        }

        BigDecimal basicHours = regular.add(holidayLeave);
        BigDecimal basePay = truncateCents(basicHours.multiply(baseRate));
        BigDecimal trueOvertimePay = overtime.signum() > 0
                ? truncateCents(overtime.multiply(baseRate))
                : PayMath.ZERO_MONEY;

        BigDecimal nightRate = truncateCents(baseRate.multiply(rates.night()));
        BigDecimal nightPay = truncateCents(night.multiply(nightRate));
        BigDecimal sundayRate = truncateCents(baseRate.multiply(rates.sunday()));
        BigDecimal sundayPay = truncateCents(sunday.multiply(sundayRate));
        BigDecimal holidayPay = truncateCents(holidayWorked.multiply(baseRate));

        Map<SupplementalCategory, BigDecimal> supplementalRates = new EnumMap<>(SupplementalCategory.class);
        Map<SupplementalCategory, BigDecimal> supplementalPay = new EnumMap<>(SupplementalCategory.class);
        BigDecimal supplementalTotal = BigDecimal.ZERO;
        for (SupplementalCategory category : SupplementalCategory.values()) {
            BigDecimal rate = truncateCents(baseRate.multiply(rates.rateFor(category)));
            BigDecimal amount = truncateCents(supplementalHours.get(category).multiply(rate));
            supplementalRates.put(category, rate);
            supplementalPay.put(category, amount);
            supplementalTotal = supplementalTotal.add(amount);
        }

        // incentive pay keeps the same share of basic pay it had on the reference statement
        BigDecimal incentivePay = PayMath.ZERO_MONEY;
        BigDecimal incentiveRate = PayMath.ZERO_MONEY;
        Optional<EarningsLine> referenceIncentive = reference.firstEarning(EarningType.INCENTIVE);
        Optional<EarningsLine> referenceRegular = reference.firstEarning(EarningType.REGULAR);
        if (referenceIncentive.isPresent() && referenceRegular.isPresent()
                && PayMath.isPositive(referenceRegular.get().currentAmount())) {
            BigDecimal historicalIncentive = PayMath.orZero(referenceIncentive.get().currentAmount());
            BigDecimal historicalRegular = referenceRegular.get().currentAmount();
            incentivePay = truncateCents(PayMath.scale(basePay, historicalIncentive, historicalRegular));
            incentiveRate = truncateCents(PayMath.scale(baseRate, historicalIncentive, historicalRegular));
        }

        BigDecimal flsaRate = PayMath.ZERO_MONEY;
        BigDecimal flsaPay = PayMath.ZERO_MONEY;
        if (overtime.signum() > 0) {
            BigDecimal straightTimeRemuneration = basePay
                    .add(trueOvertimePay)
                    .add(nightPay)
                    .add(sundayPay)
                    .add(holidayPay)
                    .add(incentivePay)
                    .add(supplementalTotal);
            BigDecimal hoursWorked = basicHours.add(overtime);
            if (hoursWorked.signum() > 0) {
                BigDecimal regularRateOfPay = PayMath.divide(straightTimeRemuneration, hoursWorked);
                flsaRate = truncateCents(regularRateOfPay.multiply(HALF));
                flsaPay = truncateCents(overtime.multiply(flsaRate));
            }
        }

        BigDecimal gross = basePay
                .add(incentivePay)
                .add(flsaPay)
                .add(trueOvertimePay)
                .add(nightPay)
                .add(sundayPay)
                .add(holidayPay)
                .add(supplementalTotal);
        gross = truncateCents(gross);

        List<EarningsLine> earnings = new ArrayList<>();
        if (basicHours.signum() > 0) {
            earnings.add(earning(EarningType.REGULAR, baseRate, basicHours, basePay, reference));
        }
        if (incentivePay.signum() != 0) {
            earnings.add(earning(EarningType.INCENTIVE, incentiveRate, basicHours, incentivePay, reference));
        }
        if (overtime.signum() > 0) {
            earnings.add(earning(EarningType.FLSA_PREMIUM, flsaRate, overtime, flsaPay, reference));
            earnings.add(earning(EarningType.TRUE_OVERTIME, baseRate, overtime, trueOvertimePay, reference));
        }
        if (night.signum() > 0) {
            earnings.add(earning(EarningType.NIGHT, nightRate, night, nightPay, reference));
        }
        if (sunday.signum() > 0) {
            earnings.add(earning(EarningType.SUNDAY, sundayRate, sunday, sundayPay, reference));
        }
        if (holidayWorked.signum() > 0) {
            earnings.add(earning(EarningType.HOLIDAY_WORKED, baseRate, holidayWorked, holidayPay, reference));
        }
        for (SupplementalCategory category : SupplementalCategory.values()) {
            BigDecimal hours = supplementalHours.get(category);
            if (hours.signum() > 0) {
                EarningType type = EarningType.valueOf(category.name());
                earnings.add(earning(type, supplementalRates.get(category), hours, supplementalPay.get(category), reference));
            }
        }

        BigDecimal referenceGross = PayMath.isPositive(reference.referenceGross())
                ? reference.referenceGross()
                : reference.earnings().stream()
                        .map(line -> PayMath.orZero(line.currentAmount()))
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
        List<DeductionLine> deductions = new ArrayList<>();
        BigDecimal totalDeductions = PayMath.ZERO_MONEY;
        for (DeductionLine line : reference.deductions()) {
            BigDecimal referenceAmount = PayMath.orZero(line.currentAmount());
            BigDecimal amount = line.kind() == DeductionKind.PERCENTAGE
                    ? truncateCents(PayMath.scale(gross, referenceAmount, referenceGross))
                    : truncateCents(referenceAmount);
            deductions.add(new DeductionLine(line.type(), amount, PayMath.ZERO_MONEY,
                    carryYtd(line.ytdAmount(), referenceAmount, amount)));
            totalDeductions = totalDeductions.add(amount);
        }

        BigDecimal net = gross.subtract(totalDeductions);

        String remarks = reference.hasRate() ? REMARKS : REMARKS + "\n" + UNRELIABLE_REMARK;
        return new PaycheckBreakdown(meta,
                earnings,
                deductions,
                projectLeave(referenceLeave),
                gross,
                totalDeductions,
                net,
                remarks,
                reference.hasRate());
    }

    private EarningsLine earning(EarningType type, BigDecimal rate, BigDecimal hours, BigDecimal amount, ReferenceContext reference) {
        BigDecimal ytd = reference.firstEarning(type)
                .map(line -> carryYtd(line.ytdAmount(), PayMath.orZero(line.currentAmount()), amount))
                .orElse(null);
        return new EarningsLine(type.getLabel(), rate, hours, amount, PayMath.ZERO_MONEY, ytd);
    }

    /** Year-to-date continues from the reference statement; without a positive reference figure it is unknown. */
    static BigDecimal carryYtd(BigDecimal referenceYtd, BigDecimal referenceCurrent, BigDecimal newCurrent) {
        if (!PayMath.isPositive(referenceYtd)) {
            return null;
        }
        return truncateCents(referenceYtd.subtract(referenceCurrent).add(newCurrent));
    }

    /** Usage is reconciled by the audit, not projected: end = start + earned. */
    private List<LeaveLine> projectLeave(List<LeaveLine> referenceLeave) {
        if (referenceLeave == null) {
            return List.of();
        }
        List<LeaveLine> projected = new ArrayList<>();
        for (LeaveLine line : referenceLeave) {
            if (line.type() == null) {
                continue;
            }
            String normalized = line.type().toLowerCase(Locale.ROOT);
            if (PROJECTED_LEAVE_TYPES.stream().noneMatch(normalized::contains)) {
                continue;
            }
            projected.add(new LeaveLine(line.type(), line.start(), line.earned(), LeaveClock.fromMinutes(0),
                    LeaveClock.add(line.start(), line.earned())));
        }
        return projected;
    }

    private static BigDecimal total(List<DailyBucket> buckets, Function<DailyBucket, BigDecimal> hours) {
        BigDecimal sum = BigDecimal.ZERO;
        for (DailyBucket bucket : buckets) {
            sum = sum.add(PayMath.orZero(hours.apply(bucket)));
        }
        return truncateHours(sum);
    }
}
