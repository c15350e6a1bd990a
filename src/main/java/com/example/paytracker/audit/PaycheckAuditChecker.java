package com.example.paytracker.audit;

import com.example.paytracker.common.PayMath;
import com.example.paytracker.paycheck.DeclaredPaycheck;
import com.example.paytracker.paycheck.EarningsLine;
import com.example.paytracker.paycheck.LeaveClock;
import com.example.paytracker.paycheck.LeaveLine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks a declared statement against its own arithmetic: leave balances carry forward, earnings add up
 * to gross and gross less deductions is net.
 */
@Component
public class PaycheckAuditChecker {

    /** Categories with no running balance. */
    static final List<String> EXEMPT_LEAVE_TYPES = List.of(
            "Admin", "Change of Station Leave", "Time Off Award", "Gov Shutdown-Excepted");

    private static final long LEAVE_TOLERANCE_MINUTES = 1;
    private static final BigDecimal MONEY_TOLERANCE = new BigDecimal("0.01");

    public AuditFlags audit(DeclaredPaycheck paycheck) {
        Map<String, String> flags = new LinkedHashMap<>();

        for (LeaveLine line : paycheck.leave()) {
            if (isExempt(line.type())) {
                continue;
            }
            long start = LeaveClock.toMinutes(line.start());
            long earned = LeaveClock.toMinutes(line.earned());
            long used = LeaveClock.toMinutes(line.used());
            long declaredEnd = LeaveClock.toMinutes(line.end());
            long computedEnd = start + earned - used;
            long off = Math.abs(computedEnd - declaredEnd);
            if (off > LEAVE_TOLERANCE_MINUTES) {
                flags.put("leave_" + line.type() + "_end", String.format(Locale.US,
                        "Math Error: %s + %s - %s should be %s, stub says %s (off by %d min)",
                        LeaveClock.format(start),
                        LeaveClock.format(earned),
                        LeaveClock.format(used),
                        LeaveClock.format(computedEnd),
                        LeaveClock.format(declaredEnd),
                        off));
            }
        }

        BigDecimal earningsSum = BigDecimal.ZERO;
        for (EarningsLine line : paycheck.earnings()) {
            earningsSum = earningsSum.add(PayMath.orZero(line.currentAmount())).add(PayMath.orZero(line.adjustedAmount()));
        }
        BigDecimal gross = PayMath.orZero(paycheck.grossPay());
        if (exceedsTolerance(earningsSum, gross)) {
            flags.put("gross_pay", String.format(Locale.US, "Sum (%,.2f) != Gross (%,.2f)", earningsSum, gross));
        }

        BigDecimal computedNet = gross.subtract(PayMath.orZero(paycheck.totalDeductions()));
        if (exceedsTolerance(computedNet, PayMath.orZero(paycheck.netPay()))) {
            flags.put("net_pay", "Math Error: Gross - Ded != Net");
        }
        return new AuditFlags(flags);
    }

    private static boolean exceedsTolerance(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(MONEY_TOLERANCE) > 0;
    }

    private static boolean isExempt(String type) {
        if (type == null) {
            return false;
        }
        return EXEMPT_LEAVE_TYPES.stream().anyMatch(exempt -> exempt.equalsIgnoreCase(type.trim()));
    }
}
